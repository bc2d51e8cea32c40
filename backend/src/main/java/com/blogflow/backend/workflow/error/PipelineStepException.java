package com.blogflow.backend.workflow.error;

/**
 * Base type for failures raised by capability implementations that already know how they should
 * be treated. Anything else is classified by {@link FailureClassifier}.
 */
public abstract class PipelineStepException extends RuntimeException {

  protected PipelineStepException(String message) {
    super(message);
  }

  protected PipelineStepException(String message, Throwable cause) {
    super(message, cause);
  }

  public abstract FailureCategory category();
}
