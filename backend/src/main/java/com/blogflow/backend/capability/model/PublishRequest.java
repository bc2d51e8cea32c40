package com.blogflow.backend.capability.model;

import java.util.List;
import java.util.Objects;

public record PublishRequest(
    String title, String body, List<String> tags, List<HostedMedia> media) {

  public PublishRequest {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(body, "body");
    tags = tags != null ? List.copyOf(tags) : List.of();
    media = media != null ? List.copyOf(media) : List.of();
  }

  public static PublishRequest of(Draft draft, List<HostedMedia> media) {
    return new PublishRequest(draft.title(), draft.body(), draft.tags(), media);
  }
}
