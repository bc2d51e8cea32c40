package com.blogflow.backend.workflow.engine;

import com.blogflow.backend.capability.UserNotifier;
import com.blogflow.backend.capability.model.WorkflowOutcome;
import com.blogflow.backend.workflow.config.PipelineProperties;
import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.StepError;
import com.blogflow.backend.workflow.domain.StepOutcome;
import com.blogflow.backend.workflow.domain.StepResult;
import com.blogflow.backend.workflow.domain.WorkflowStage;
import com.blogflow.backend.workflow.domain.WorkflowState;
import com.blogflow.backend.workflow.error.FailureCategory;
import com.blogflow.backend.workflow.error.FailureClassifier;
import com.blogflow.backend.workflow.error.FailureSummaries;
import com.blogflow.backend.workflow.telemetry.PipelineTelemetryService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.springframework.stereotype.Component;

/**
 * Sends the single terminal notification of a workflow. Runs once, is never retried and never
 * fails the workflow: a notifier error is recorded in the history and counted, nothing more.
 */
@Component
public class ResultNotifier {

  private final UserNotifier userNotifier;
  private final StepInvoker stepInvoker;
  private final FailureClassifier classifier;
  private final PipelineTelemetryService telemetry;
  private final Clock clock;
  private final Duration timeout;

  public ResultNotifier(
      UserNotifier userNotifier,
      StepInvoker stepInvoker,
      FailureClassifier classifier,
      PipelineTelemetryService telemetry,
      PipelineProperties properties,
      Clock clock) {
    this.userNotifier = Objects.requireNonNull(userNotifier, "userNotifier");
    this.stepInvoker = Objects.requireNonNull(stepInvoker, "stepInvoker");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.timeout = properties.getStep().getTimeout();
  }

  public StepResult notifyOnce(WorkflowState state) {
    if (!state.claimNotification()) {
      throw new IllegalStateException(
          "Workflow " + state.workflowId() + " has already been notified");
    }
    Instant startedAt = clock.instant();
    WorkflowOutcome outcome = buildOutcome(state, startedAt);
    state.beginStep(PipelineStep.NOTIFY);
    StepResult result;
    try {
      stepInvoker.invoke(
          PipelineStep.NOTIFY,
          timeout,
          () -> {
            userNotifier.notify(outcome);
            return null;
          });
      result = StepResult.success(PipelineStep.NOTIFY, 1, outcome, startedAt, clock.instant());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      result = failed(ex, startedAt, state);
    } catch (ExecutionException | RuntimeException ex) {
      result = failed(ex, startedAt, state);
    }
    state.record(result);
    telemetry.stepCompleted(
        state.workflowId(), PipelineStep.NOTIFY, 1, result.outcome(), result.duration());
    return result;
  }

  WorkflowOutcome buildOutcome(WorkflowState state, Instant now) {
    Duration elapsed = state.elapsed(now);
    if (state.stage() == WorkflowStage.PUBLISHED) {
      return WorkflowOutcome.succeeded(
          state.workflowId(),
          state.userId(),
          state.draft(),
          state.publishedPost(),
          state.mediaResolution(),
          elapsed);
    }
    PipelineStep failedStep = state.failedStep();
    FailureCategory category =
        state.failureCategory() != null ? state.failureCategory() : FailureCategory.UNCLASSIFIED;
    return WorkflowOutcome.failed(
        state.workflowId(),
        state.userId(),
        failedStep,
        category,
        FailureSummaries.describe(failedStep, category),
        failedStep != null ? state.attemptsOf(failedStep) : 0,
        elapsed);
  }

  private StepResult failed(Exception ex, Instant startedAt, WorkflowState state) {
    Throwable failure = FailureClassifier.unwrap(ex);
    telemetry.notifyFailed(state.workflowId(), failure);
    StepError error =
        new StepError(
            classifier.classify(failure),
            failure.getClass().getSimpleName(),
            failure.getMessage(),
            null);
    return StepResult.failure(
        PipelineStep.NOTIFY, 1, StepOutcome.FATAL_FAILURE, error, startedAt, clock.instant());
  }
}
