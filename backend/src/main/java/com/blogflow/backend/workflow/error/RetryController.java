package com.blogflow.backend.workflow.error;

import com.blogflow.backend.workflow.config.PipelineProperties;
import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.StepError;
import com.blogflow.backend.workflow.domain.StepOutcome;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.context.RetryContextSupport;
import org.springframework.stereotype.Component;

/**
 * Sole translator from raw step failures to the outcomes the workflow engine acts on. Also owns
 * the retry budget, the backoff policy and the workflow wall-clock cap derived from them.
 */
@Component
public class RetryController {

  private static final Logger log = LoggerFactory.getLogger(RetryController.class);
  private static final int MAX_CAUSE_DEPTH = 5;

  private final FailureClassifier classifier;
  private final int maxRetries;
  private final StepBackOffPolicy backOffPolicy;
  private final Duration stepTimeout;
  private final Duration deadlineOverride;

  public RetryController(
      PipelineProperties properties, FailureClassifier classifier, Sleeper retrySleeper) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    PipelineProperties.Retry retry = properties.getRetry();
    this.maxRetries = Math.max(0, retry.getMaxRetriesPerStep());
    this.backOffPolicy =
        new StepBackOffPolicy(
                retry.getBackoffMode(),
                retry.getBackoffSchedule(),
                retry.getMaxBackoff(),
                retry.getResourceExhaustionMultiplier())
            .withSleeper(Objects.requireNonNull(retrySleeper, "retrySleeper"));
    this.stepTimeout = properties.getStep().getTimeout();
    this.deadlineOverride = properties.getWorkflow().getDeadline();
  }

  public FailureDecision decide(PipelineStep step, int attempt, Throwable error) {
    Throwable failure = FailureClassifier.unwrap(error);
    FailureCategory category = classifier.classify(failure);
    StepOutcome outcome =
        category.isRetryable() ? StepOutcome.RETRYABLE_FAILURE : StepOutcome.FATAL_FAILURE;
    if (category == FailureCategory.UNCLASSIFIED) {
      log.error(
          "Unclassified failure in step {} attempt {}, treating as fatal",
          step.getCode(),
          attempt,
          failure);
    } else {
      log.debug("Step {} attempt {} failed with {}", step.getCode(), attempt, category);
    }
    return new FailureDecision(outcome, toStepError(category, failure));
  }

  public FailureDecision deadlineExceeded(PipelineStep step, Duration deadline) {
    return new FailureDecision(
        StepOutcome.FATAL_FAILURE,
        new StepError(
            FailureCategory.DEADLINE_EXCEEDED,
            "WorkflowDeadline",
            "Workflow exceeded " + deadline.toMillis() + " ms before step " + step.getCode(),
            null));
  }

  /** Whether a step that has already been retried {@code retriesUsed} times may run again. */
  public boolean canRetry(int retriesUsed) {
    return retriesUsed < maxRetries;
  }

  public int maxRetries() {
    return maxRetries;
  }

  /** Delay before the {@code retryNumber}-th retry (1-based) of a step. */
  public Duration backoff(FailureCategory category, int retryNumber) {
    return backOffPolicy.delay(category, retryNumber);
  }

  /**
   * Blocks the workflow thread for the backoff of the {@code retryNumber}-th retry.
   *
   * @throws BackOffInterruptedException if the thread is interrupted while waiting
   */
  public void backOff(PipelineStep step, FailureCategory category, int retryNumber) {
    RetryContextSupport context = new RetryContextSupport(null);
    context.setAttribute(RetryContext.NAME, step.getCode());
    context.setAttribute(StepBackOffPolicy.RETRY_NUMBER_ATTRIBUTE, retryNumber);
    context.setAttribute(StepBackOffPolicy.CATEGORY_ATTRIBUTE, category);
    backOffPolicy.backOff(backOffPolicy.start(context));
  }

  /**
   * Wall-clock cap for a workflow running {@code stepCount} retryable steps: every attempt of
   * every step timing out, separated by the longest (elevated tier) backoffs.
   */
  public Duration workflowDeadline(int stepCount) {
    if (deadlineOverride != null && !deadlineOverride.isNegative() && !deadlineOverride.isZero()) {
      return deadlineOverride;
    }
    Duration perStep = stepTimeout.multipliedBy(maxRetries + 1L);
    for (int n = 1; n <= maxRetries; n++) {
      perStep = perStep.plus(backoff(FailureCategory.RESOURCE_EXHAUSTION, n));
    }
    return perStep.multipliedBy(Math.max(1, stepCount));
  }

  private StepError toStepError(FailureCategory category, Throwable failure) {
    if (failure == null) {
      return new StepError(category, "Unknown", "unknown failure", null);
    }
    return new StepError(
        category,
        failure.getClass().getSimpleName(),
        failure.getMessage(),
        describeCauses(failure));
  }

  static String describeCauses(Throwable failure) {
    StringBuilder detail = new StringBuilder();
    Throwable current = failure;
    int depth = 0;
    while (current != null && depth < MAX_CAUSE_DEPTH) {
      if (depth > 0) {
        detail.append(" <- ");
      }
      detail.append(current.getClass().getName());
      if (current.getMessage() != null) {
        detail.append(": ").append(current.getMessage());
      }
      current = current.getCause() != current ? current.getCause() : null;
      depth++;
    }
    return detail.toString();
  }
}
