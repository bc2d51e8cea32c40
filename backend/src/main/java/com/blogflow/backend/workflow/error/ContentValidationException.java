package com.blogflow.backend.workflow.error;

/** Content is malformed or empty; running the step again cannot fix it. */
public class ContentValidationException extends PipelineStepException {

  public ContentValidationException(String message) {
    super(message);
  }

  public ContentValidationException(String message, Throwable cause) {
    super(message, cause);
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.VALIDATION;
  }
}
