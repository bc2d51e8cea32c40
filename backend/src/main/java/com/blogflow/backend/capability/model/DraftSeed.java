package com.blogflow.backend.capability.model;

import java.util.List;
import java.util.Objects;

/** Structured content intent derived from a batch: what the post is about. */
public record DraftSeed(String topic, String summary, List<String> tags, String sourceText) {

  public DraftSeed {
    Objects.requireNonNull(topic, "topic");
    summary = summary != null ? summary : "";
    tags = tags != null ? List.copyOf(tags) : List.of();
    sourceText = sourceText != null ? sourceText : "";
  }
}
