package com.blogflow.backend.workflow.domain;

import com.blogflow.backend.workflow.error.FailureCategory;
import java.util.Objects;

/**
 * Diagnostic context of a failed attempt. {@code detail} holds the cause chain and is meant for
 * operators; nothing here is shown to end users.
 */
public record StepError(FailureCategory category, String errorType, String message, String detail) {

  public StepError {
    Objects.requireNonNull(category, "category");
  }
}
