package com.blogflow.backend.capability.model;

import com.blogflow.backend.workflow.domain.StepError;
import com.blogflow.backend.workflow.error.FailureCategory;
import java.util.Objects;
import java.util.UUID;

/** Media unit left out of the post because it could not be hosted. */
public record DroppedMedia(UUID unitId, StepError error) {

  public DroppedMedia {
    Objects.requireNonNull(unitId, "unitId");
    Objects.requireNonNull(error, "error");
  }

  public FailureCategory category() {
    return error.category();
  }
}
