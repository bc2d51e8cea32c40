package com.blogflow.backend.integration;

import com.blogflow.backend.capability.model.WorkflowOutcome;
import java.time.Duration;
import java.util.Locale;

/** Plain-text rendering of a terminal outcome, shared by the user-facing notifiers. */
public final class OutcomeMessageFormatter {

  private OutcomeMessageFormatter() {}

  public static String format(WorkflowOutcome outcome) {
    return outcome.isSuccess() ? formatSuccess(outcome) : formatFailure(outcome);
  }

  private static String formatSuccess(WorkflowOutcome outcome) {
    StringBuilder text = new StringBuilder("Your post is published!\n");
    text.append("Title: ").append(outcome.title()).append('\n');
    text.append("URL: ").append(outcome.locator()).append('\n');
    if (!outcome.tags().isEmpty()) {
      text.append("Tags: ").append(String.join(", ", outcome.tags())).append('\n');
    }
    if (outcome.hostedMedia() > 0 || outcome.droppedMedia() > 0) {
      text.append("Media: ").append(outcome.hostedMedia()).append(" uploaded");
      if (outcome.droppedMedia() > 0) {
        text.append(", ").append(outcome.droppedMedia()).append(" could not be uploaded");
      }
      text.append('\n');
    }
    text.append("Took ").append(seconds(outcome.elapsed()));
    return text.toString();
  }

  private static String formatFailure(WorkflowOutcome outcome) {
    StringBuilder text = new StringBuilder("Sorry, your post could not be published.\n");
    text.append(outcome.failureReason() != null ? outcome.failureReason() : "Processing failed.");
    if (outcome.failedStep() != null) {
      text.append("\nStep: ")
          .append(outcome.failedStep().getCode())
          .append(" (")
          .append(outcome.attempts())
          .append(outcome.attempts() == 1 ? " attempt)" : " attempts)");
    }
    return text.toString();
  }

  private static String seconds(Duration elapsed) {
    return String.format(Locale.ROOT, "%.1fs", elapsed.toMillis() / 1000.0d);
  }
}
