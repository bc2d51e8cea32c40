package com.blogflow.backend.workflow.error;

public class TransientExternalException extends PipelineStepException {

  public TransientExternalException(String message) {
    super(message);
  }

  public TransientExternalException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.TRANSIENT_EXTERNAL;
  }
}
