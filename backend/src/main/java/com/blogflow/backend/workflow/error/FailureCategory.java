package com.blogflow.backend.workflow.error;

public enum FailureCategory {
  TRANSIENT_EXTERNAL(true),
  RESOURCE_EXHAUSTION(true),
  VALIDATION(false),
  AUTHORIZATION(false),
  DEADLINE_EXCEEDED(false),
  UNCLASSIFIED(false);

  private final boolean retryable;

  FailureCategory(boolean retryable) {
    this.retryable = retryable;
  }

  public boolean isRetryable() {
    return retryable;
  }
}
