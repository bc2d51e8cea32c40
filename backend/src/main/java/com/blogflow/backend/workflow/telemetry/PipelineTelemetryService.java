package com.blogflow.backend.workflow.telemetry;

import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.StepOutcome;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import com.blogflow.backend.workflow.error.FailureCategory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class PipelineTelemetryService {

  private static final Logger log = LoggerFactory.getLogger(PipelineTelemetryService.class);

  private final MeterRegistry meterRegistry;
  private final AtomicInteger activeWorkflows;
  private final Counter batchesFlushed;
  private final DistributionSummary batchSize;
  private final Counter notifyFailures;
  private final Counter deadlineExceeded;

  public PipelineTelemetryService(MeterRegistry meterRegistry) {
    this.meterRegistry = meterRegistry != null ? meterRegistry : new SimpleMeterRegistry();
    this.activeWorkflows = new AtomicInteger();
    this.meterRegistry.gauge("pipeline_workflows_active", activeWorkflows);
    this.batchesFlushed = this.meterRegistry.counter("pipeline_batches_flushed_total");
    this.batchSize = this.meterRegistry.summary("pipeline_batch_size");
    this.notifyFailures = this.meterRegistry.counter("pipeline_notify_failures_total");
    this.deadlineExceeded = this.meterRegistry.counter("pipeline_workflow_deadline_exceeded_total");
  }

  public void unitReceived(String userId, UnitKind kind, long batchId, int pendingUnits) {
    meterRegistry.counter("pipeline_units_received_total", "kind", kind.getCode()).increment();
    log.debug(
        "User {} batch {} received {} unit ({} pending)",
        userId,
        batchId,
        kind.getCode(),
        pendingUnits);
  }

  public void batchFlushed(UserBatch batch) {
    batchesFlushed.increment();
    batchSize.record(batch.size());
    log.info(
        "Batch {} for user {} flushed with {} unit(s) ({} media)",
        batch.batchId(),
        batch.userId(),
        batch.size(),
        batch.mediaUnits().size());
  }

  public void workflowStarted(UUID workflowId, UserBatch batch) {
    activeWorkflows.incrementAndGet();
    log.info(
        "Workflow {} started for user {} batch {}", workflowId, batch.userId(), batch.batchId());
  }

  public void workflowFinished(UUID workflowId, WorkflowStatus status, Duration duration) {
    activeWorkflows.decrementAndGet();
    meterRegistry
        .counter("pipeline_workflows_finished_total", "status", status.name().toLowerCase())
        .increment();
    log.info(
        "Workflow {} finished with status {} in {} ms",
        workflowId,
        status,
        duration != null ? duration.toMillis() : "n/a");
  }

  public void stepCompleted(
      UUID workflowId, PipelineStep step, int attempt, StepOutcome outcome, Duration duration) {
    Timer timer =
        Timer.builder("pipeline_step_duration")
            .tag("step", step.getCode())
            .tag("outcome", outcome.name().toLowerCase())
            .register(meterRegistry);
    if (duration != null) {
      timer.record(duration);
    }
    log.info(
        "Workflow {} step {} attempt {} finished with {} in {} ms",
        workflowId,
        step.getCode(),
        attempt,
        outcome,
        duration != null ? duration.toMillis() : "n/a");
  }

  public void retryScheduled(
      UUID workflowId, PipelineStep step, int attempt, FailureCategory category, Duration delay) {
    meterRegistry.counter("pipeline_step_retries_total", "step", step.getCode()).increment();
    log.warn(
        "Workflow {} step {} attempt {} failed ({}), retrying in {} ms",
        workflowId,
        step.getCode(),
        attempt,
        category,
        delay.toMillis());
  }

  public void notifyFailed(UUID workflowId, Throwable error) {
    notifyFailures.increment();
    log.warn(
        "Workflow {} terminal notification failed: {}",
        workflowId,
        error != null ? error.getMessage() : "unknown");
  }

  public void deadlineExceeded(UUID workflowId, PipelineStep step, Duration deadline) {
    deadlineExceeded.increment();
    log.warn(
        "Workflow {} exceeded its {} ms deadline at step {}",
        workflowId,
        deadline.toMillis(),
        step != null ? step.getCode() : "n/a");
  }

  public int activeWorkflows() {
    return activeWorkflows.get();
  }
}
