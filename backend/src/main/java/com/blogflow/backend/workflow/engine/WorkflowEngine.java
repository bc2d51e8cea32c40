package com.blogflow.backend.workflow.engine;

import com.blogflow.backend.capability.BlogPublisher;
import com.blogflow.backend.capability.ContentAnalyzer;
import com.blogflow.backend.capability.DraftGenerator;
import com.blogflow.backend.capability.model.MediaResolution;
import com.blogflow.backend.capability.model.PublishRequest;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.config.PipelineProperties;
import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.StepOutcome;
import com.blogflow.backend.workflow.domain.StepResult;
import com.blogflow.backend.workflow.domain.Transition;
import com.blogflow.backend.workflow.domain.TransitionAction;
import com.blogflow.backend.workflow.domain.WorkflowStage;
import com.blogflow.backend.workflow.domain.WorkflowState;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import com.blogflow.backend.workflow.error.FailureCategory;
import com.blogflow.backend.workflow.error.FailureDecision;
import com.blogflow.backend.workflow.error.RetryController;
import com.blogflow.backend.workflow.registry.WorkflowRegistry;
import com.blogflow.backend.workflow.telemetry.PipelineTelemetryService;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.stereotype.Component;

/**
 * Drives one flushed batch through the pipeline on the calling thread. Steps run strictly one
 * after another; each step's result is recorded before the next transition is taken, and the
 * terminal notification is sent exactly once whichever way the run ends.
 */
@Component
public class WorkflowEngine {

  private static final Logger log = LoggerFactory.getLogger(WorkflowEngine.class);

  private final ContentAnalyzer contentAnalyzer;
  private final DraftGenerator draftGenerator;
  private final BlogPublisher blogPublisher;
  private final MediaUploadStep mediaUploadStep;
  private final ResultNotifier resultNotifier;
  private final StepInvoker stepInvoker;
  private final RetryController retryController;
  private final WorkflowTransitionTable transitionTable;
  private final WorkflowRegistry registry;
  private final PipelineTelemetryService telemetry;
  private final Clock clock;
  private final Duration stepTimeout;

  public WorkflowEngine(
      ContentAnalyzer contentAnalyzer,
      DraftGenerator draftGenerator,
      BlogPublisher blogPublisher,
      MediaUploadStep mediaUploadStep,
      ResultNotifier resultNotifier,
      StepInvoker stepInvoker,
      RetryController retryController,
      WorkflowTransitionTable transitionTable,
      WorkflowRegistry registry,
      PipelineTelemetryService telemetry,
      Clock clock,
      PipelineProperties properties) {
    this.contentAnalyzer = Objects.requireNonNull(contentAnalyzer, "contentAnalyzer");
    this.draftGenerator = Objects.requireNonNull(draftGenerator, "draftGenerator");
    this.blogPublisher = Objects.requireNonNull(blogPublisher, "blogPublisher");
    this.mediaUploadStep = Objects.requireNonNull(mediaUploadStep, "mediaUploadStep");
    this.resultNotifier = Objects.requireNonNull(resultNotifier, "resultNotifier");
    this.stepInvoker = Objects.requireNonNull(stepInvoker, "stepInvoker");
    this.retryController = Objects.requireNonNull(retryController, "retryController");
    this.transitionTable = Objects.requireNonNull(transitionTable, "transitionTable");
    this.registry = Objects.requireNonNull(registry, "registry");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.stepTimeout = properties.getStep().getTimeout();
  }

  public WorkflowState execute(UserBatch batch) {
    Objects.requireNonNull(batch, "batch");
    Instant startedAt = clock.instant();
    Duration deadline = retryController.workflowDeadline(batch.hasMedia() ? 4 : 3);
    WorkflowState state =
        new WorkflowState(UUID.randomUUID(), batch, startedAt, startedAt.plus(deadline));
    registry.register(state);
    telemetry.workflowStarted(state.workflowId(), batch);

    boolean interrupted = false;
    try {
      interrupted = runSteps(state, deadline);
    } catch (RuntimeException ex) {
      log.error(
          "Workflow {} failed unexpectedly in stage {}", state.workflowId(), state.stage(), ex);
      if (state.stage() != WorkflowStage.ABORTED) {
        state.abort(state.currentStep(), FailureCategory.UNCLASSIFIED);
      }
    }

    // a pending interrupt would fail the notification immediately
    if (interrupted) {
      Thread.interrupted();
    }
    try {
      StepResult notification = resultNotifier.notifyOnce(state);
      Transition transition = transitionTable.resolve(state.stage(), notification.outcome());
      if (transition.target() != state.stage()) {
        state.advanceTo(transition.target());
      }
    } finally {
      WorkflowStatus status =
          state.stage() == WorkflowStage.ABORTED ? WorkflowStatus.FAILED : WorkflowStatus.SUCCEEDED;
      Instant finishedAt = clock.instant();
      state.finish(status, finishedAt);
      registry.finished(state);
      telemetry.workflowFinished(
          state.workflowId(), status, Duration.between(startedAt, finishedAt));
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }
    return state;
  }

  /** Runs working steps until the workflow is published or aborted. Returns true if interrupted. */
  private boolean runSteps(WorkflowState state, Duration deadline) {
    while (!state.stage().awaitsNotification()) {
      WorkflowStage stage = state.stage();
      PipelineStep step = transitionTable.stepFor(stage);
      if (step == PipelineStep.UPLOAD_MEDIA && !state.sourceBatch().hasMedia()) {
        log.debug("Workflow {} has no media, skipping upload", state.workflowId());
        state.applyOutput(step, MediaResolution.none());
        state.advanceTo(transitionTable.resolve(stage, StepOutcome.SUCCESS).target());
        continue;
      }

      state.beginStep(step);
      StepResult result;
      try {
        result = attempt(state, step, deadline);
      } catch (InterruptedException ex) {
        log.warn("Workflow {} interrupted during step {}", state.workflowId(), step.getCode());
        state.abort(step, FailureCategory.UNCLASSIFIED);
        return true;
      }
      state.record(result);
      telemetry.stepCompleted(
          state.workflowId(), step, result.attempt(), result.outcome(), result.duration());

      Transition transition = transitionTable.resolve(stage, result.outcome());
      if (transition.action() == TransitionAction.RETRY) {
        transition = scheduleRetry(state, step, result, deadline);
        if (transition == null) {
          return true;
        }
      }
      switch (transition.action()) {
        case ADVANCE -> {
          state.applyOutput(step, result.data());
          state.advanceTo(transition.target());
        }
        case ABORT -> {
          if (state.stage() != WorkflowStage.ABORTED) {
            state.abort(
                step,
                result.error() != null ? result.error().category() : FailureCategory.UNCLASSIFIED);
          }
          log.warn(
              "Workflow {} aborted at step {} after {} attempt(s): {}",
              state.workflowId(),
              step.getCode(),
              result.attempt(),
              state.failureCategory());
        }
        case RETRY -> {
          // same stage, next loop iteration runs the step again
        }
        case COMPLETE -> throw new IllegalStateException("Working stage cannot complete: " + stage);
      }
    }
    return false;
  }

  /**
   * Waits out the backoff for a retryable failure. Returns the transition to take: the original
   * retry, an abort when the budget or the deadline is exhausted, or null if interrupted.
   */
  private Transition scheduleRetry(
      WorkflowState state, PipelineStep step, StepResult result, Duration deadline) {
    int retriesUsed = state.retriesUsed(step);
    if (!retryController.canRetry(retriesUsed)) {
      log.warn(
          "Workflow {} step {} exhausted {} retries",
          state.workflowId(),
          step.getCode(),
          retryController.maxRetries());
      return Transition.abort();
    }
    FailureCategory category = result.error().category();
    Duration delay = retryController.backoff(category, retriesUsed + 1);
    if (clock.instant().plus(delay).isAfter(state.deadline())) {
      telemetry.deadlineExceeded(state.workflowId(), step, deadline);
      state.abort(step, FailureCategory.DEADLINE_EXCEEDED);
      return Transition.abort();
    }
    state.markRetrying(step);
    telemetry.retryScheduled(state.workflowId(), step, result.attempt(), category, delay);
    try {
      retryController.backOff(step, category, retriesUsed + 1);
    } catch (BackOffInterruptedException ex) {
      log.warn(
          "Workflow {} interrupted while backing off step {}", state.workflowId(), step.getCode());
      state.abort(step, FailureCategory.UNCLASSIFIED);
      return null;
    }
    return Transition.retry(state.stage());
  }

  private StepResult attempt(WorkflowState state, PipelineStep step, Duration deadline)
      throws InterruptedException {
    int attempt = state.attemptsOf(step) + 1;
    Instant startedAt = clock.instant();
    Duration remaining = Duration.between(startedAt, state.deadline());
    if (remaining.isNegative() || remaining.isZero()) {
      telemetry.deadlineExceeded(state.workflowId(), step, deadline);
      FailureDecision decision = retryController.deadlineExceeded(step, deadline);
      return StepResult.failure(
          step, attempt, decision.outcome(), decision.error(), startedAt, startedAt);
    }
    Duration timeout = remaining.compareTo(stepTimeout) < 0 ? remaining : stepTimeout;
    try {
      Object data = run(state, step, timeout);
      return StepResult.success(step, attempt, data, startedAt, clock.instant());
    } catch (InterruptedException ex) {
      throw ex;
    } catch (Exception ex) {
      FailureDecision decision = retryController.decide(step, attempt, ex);
      return StepResult.failure(
          step, attempt, decision.outcome(), decision.error(), startedAt, clock.instant());
    }
  }

  private Object run(WorkflowState state, PipelineStep step, Duration timeout) throws Exception {
    return switch (step) {
      case ANALYZE -> stepInvoker.invoke(
          step, timeout, () -> contentAnalyzer.analyze(state.sourceBatch()));
      case GENERATE_DRAFT -> stepInvoker.invoke(
          step, timeout, () -> draftGenerator.generate(state.draftSeed()));
      case UPLOAD_MEDIA -> mediaUploadStep.run(
          state, timeout, !retryController.canRetry(state.retriesUsed(step)));
      case PUBLISH -> stepInvoker.invoke(
          step,
          timeout,
          () -> blogPublisher.publish(
              PublishRequest.of(state.draft(), state.mediaResolution().hosted())));
      case NOTIFY -> throw new IllegalStateException("Notification is sent by ResultNotifier");
    };
  }
}
