package com.blogflow.backend.workflow.error;

public class AuthorizationException extends PipelineStepException {

  public AuthorizationException(String message) {
    super(message);
  }

  public AuthorizationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.AUTHORIZATION;
  }
}
