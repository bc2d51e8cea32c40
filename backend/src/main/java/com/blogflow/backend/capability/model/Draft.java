package com.blogflow.backend.capability.model;

import java.util.List;
import java.util.Objects;

public record Draft(String title, String body, List<String> tags) {

  public Draft {
    Objects.requireNonNull(title, "title");
    Objects.requireNonNull(body, "body");
    tags = tags != null ? List.copyOf(tags) : List.of();
  }
}
