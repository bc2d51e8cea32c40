package com.blogflow.backend.workflow.error;

/** Rate limit or quota hit upstream. Retried on the elevated backoff tier. */
public class ResourceExhaustedException extends PipelineStepException {

  public ResourceExhaustedException(String message) {
    super(message);
  }

  public ResourceExhaustedException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.RESOURCE_EXHAUSTION;
  }
}
