package com.blogflow.backend.workflow.error;

import com.blogflow.backend.workflow.domain.PipelineStep;

/** User-facing wording for a failed workflow. Built from the step and category only. */
public final class FailureSummaries {

  private FailureSummaries() {}

  public static String describe(PipelineStep step, FailureCategory category) {
    return stepPhrase(step) + ": " + categoryPhrase(category);
  }

  static String stepPhrase(PipelineStep step) {
    if (step == null) {
      return "Processing failed";
    }
    return switch (step) {
      case ANALYZE -> "Could not analyze your messages";
      case GENERATE_DRAFT -> "Could not write the draft";
      case UPLOAD_MEDIA -> "Could not upload your media";
      case PUBLISH -> "Could not publish the post";
      case NOTIFY -> "Could not send the result";
    };
  }

  static String categoryPhrase(FailureCategory category) {
    if (category == null) {
      return "an unexpected error occurred.";
    }
    return switch (category) {
      case TRANSIENT_EXTERNAL -> "an external service kept failing, please try again later.";
      case RESOURCE_EXHAUSTION -> "a service rate limit was reached, please try again later.";
      case VALIDATION -> "the content could not be used. Try sending more text.";
      case AUTHORIZATION -> "the service rejected our credentials.";
      case DEADLINE_EXCEEDED -> "processing took too long and was stopped.";
      case UNCLASSIFIED -> "an unexpected error occurred.";
    };
  }
}
