package com.blogflow.backend.workflow.domain;

import com.blogflow.backend.capability.model.Draft;
import com.blogflow.backend.capability.model.DraftSeed;
import com.blogflow.backend.capability.model.DroppedMedia;
import com.blogflow.backend.capability.model.HostedMedia;
import com.blogflow.backend.capability.model.MediaResolution;
import com.blogflow.backend.capability.model.PublishedPost;
import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.error.FailureCategory;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Run-time state of one workflow over one flushed batch. Mutated only by the thread executing the
 * workflow; status queries read it through {@link #snapshot()}.
 *
 * <p>The history is append-only: every attempt of every step, retries included, is recorded in
 * execution order.
 */
public class WorkflowState {

  private final UUID workflowId;
  private final UserBatch sourceBatch;
  private final Instant startedAt;
  private final Instant deadline;
  private final List<StepResult> history = new ArrayList<>();
  private final Map<PipelineStep, Integer> retryCounts = new EnumMap<>(PipelineStep.class);
  private final Map<UUID, HostedMedia> hostedMedia = new LinkedHashMap<>();
  private final Map<UUID, DroppedMedia> droppedMedia = new LinkedHashMap<>();

  private WorkflowStage stage = WorkflowStage.RECEIVED;
  private WorkflowStatus status = WorkflowStatus.RUNNING;
  private PipelineStep currentStep;
  private PipelineStep retryingStep;
  private DraftSeed draftSeed;
  private Draft draft;
  private MediaResolution mediaResolution;
  private PublishedPost publishedPost;
  private PipelineStep failedStep;
  private FailureCategory failureCategory;
  private boolean notified;
  private Instant finishedAt;

  public WorkflowState(
      UUID workflowId, UserBatch sourceBatch, Instant startedAt, Instant deadline) {
    this.workflowId = Objects.requireNonNull(workflowId, "workflowId");
    this.sourceBatch = Objects.requireNonNull(sourceBatch, "sourceBatch");
    this.startedAt = Objects.requireNonNull(startedAt, "startedAt");
    this.deadline = deadline;
  }

  public UUID workflowId() {
    return workflowId;
  }

  public UserBatch sourceBatch() {
    return sourceBatch;
  }

  public String userId() {
    return sourceBatch.userId();
  }

  public Instant startedAt() {
    return startedAt;
  }

  public Instant deadline() {
    return deadline;
  }

  public synchronized WorkflowStage stage() {
    return stage;
  }

  public synchronized WorkflowStatus status() {
    return status;
  }

  public synchronized PipelineStep currentStep() {
    return currentStep;
  }

  public synchronized PipelineStep retryingStep() {
    return retryingStep;
  }

  public synchronized List<StepResult> history() {
    return List.copyOf(history);
  }

  public synchronized void beginStep(PipelineStep step) {
    requireRunning();
    this.currentStep = step;
  }

  public synchronized void record(StepResult result) {
    Objects.requireNonNull(result, "result");
    if (currentStep != null && currentStep != result.step()) {
      throw new IllegalStateException(
          "Result for " + result.step() + " recorded while " + currentStep + " is running");
    }
    history.add(result);
  }

  public synchronized int retriesUsed(PipelineStep step) {
    return retryCounts.getOrDefault(step, 0);
  }

  public synchronized int attemptsOf(PipelineStep step) {
    return (int) history.stream().filter(result -> result.step() == step).count();
  }

  public synchronized int markRetrying(PipelineStep step) {
    requireRunning();
    int used = retryCounts.merge(step, 1, Integer::sum);
    this.retryingStep = step;
    return used;
  }

  public synchronized void advanceTo(WorkflowStage next) {
    requireRunning();
    this.stage = Objects.requireNonNull(next, "next");
    this.retryingStep = null;
  }

  public synchronized void abort(PipelineStep step, FailureCategory category) {
    requireRunning();
    this.stage = WorkflowStage.ABORTED;
    this.retryingStep = null;
    this.failedStep = step;
    this.failureCategory = category;
  }

  public synchronized void applyOutput(PipelineStep step, Object data) {
    switch (step) {
      case ANALYZE -> this.draftSeed = (DraftSeed) data;
      case GENERATE_DRAFT -> this.draft = (Draft) data;
      case UPLOAD_MEDIA -> this.mediaResolution = (MediaResolution) data;
      case PUBLISH -> this.publishedPost = (PublishedPost) data;
      case NOTIFY -> {
        // nothing to keep
      }
    }
  }

  public synchronized void mediaHosted(HostedMedia media) {
    hostedMedia.put(media.unitId(), media);
  }

  public synchronized void mediaDropped(DroppedMedia media) {
    droppedMedia.put(media.unitId(), media);
  }

  /** Media units that are neither hosted nor given up on yet, in arrival order. */
  public synchronized List<InboundUnit> unresolvedMedia() {
    return sourceBatch.mediaUnits().stream()
        .filter(unit -> !hostedMedia.containsKey(unit.id()) && !droppedMedia.containsKey(unit.id()))
        .toList();
  }

  public synchronized MediaResolution currentMedia() {
    return new MediaResolution(
        new ArrayList<>(hostedMedia.values()), new ArrayList<>(droppedMedia.values()));
  }

  /** Returns true the first time only; the terminal notification is sent at most once. */
  public synchronized boolean claimNotification() {
    if (notified) {
      return false;
    }
    notified = true;
    return true;
  }

  public synchronized void finish(WorkflowStatus terminal, Instant at) {
    if (!terminal.isTerminal()) {
      throw new IllegalArgumentException("terminal status expected");
    }
    requireRunning();
    this.status = terminal;
    this.finishedAt = at;
    this.currentStep = null;
  }

  public synchronized DraftSeed draftSeed() {
    return draftSeed;
  }

  public synchronized Draft draft() {
    return draft;
  }

  public synchronized MediaResolution mediaResolution() {
    return mediaResolution;
  }

  public synchronized PublishedPost publishedPost() {
    return publishedPost;
  }

  public synchronized PipelineStep failedStep() {
    return failedStep;
  }

  public synchronized FailureCategory failureCategory() {
    return failureCategory;
  }

  public synchronized boolean isNotified() {
    return notified;
  }

  public synchronized Instant finishedAt() {
    return finishedAt;
  }

  public synchronized Duration elapsed(Instant now) {
    Instant end = finishedAt != null ? finishedAt : now;
    return Duration.between(startedAt, end);
  }

  public synchronized WorkflowSnapshot snapshot() {
    return new WorkflowSnapshot(
        workflowId,
        sourceBatch.userId(),
        sourceBatch.batchId(),
        sourceBatch.size(),
        status,
        stage,
        currentStep,
        retryingStep,
        new EnumMap<>(retryCounts),
        List.copyOf(history),
        publishedPost != null ? publishedPost.locator() : null,
        failedStep,
        failureCategory,
        notified,
        startedAt,
        finishedAt,
        deadline);
  }

  private void requireRunning() {
    if (status.isTerminal()) {
      throw new IllegalStateException("Workflow " + workflowId + " already finished");
    }
  }
}
