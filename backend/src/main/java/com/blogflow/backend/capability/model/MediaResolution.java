package com.blogflow.backend.capability.model;

import java.util.List;

public record MediaResolution(List<HostedMedia> hosted, List<DroppedMedia> dropped) {

  public MediaResolution {
    hosted = hosted != null ? List.copyOf(hosted) : List.of();
    dropped = dropped != null ? List.copyOf(dropped) : List.of();
  }

  public static MediaResolution none() {
    return new MediaResolution(List.of(), List.of());
  }
}
