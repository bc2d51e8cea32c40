package com.blogflow.backend.workflow.domain;

import com.blogflow.backend.workflow.error.FailureCategory;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record WorkflowSnapshot(
    UUID workflowId,
    String userId,
    long batchId,
    int unitCount,
    WorkflowStatus status,
    WorkflowStage stage,
    PipelineStep currentStep,
    PipelineStep retryingStep,
    Map<PipelineStep, Integer> retryCounts,
    List<StepResult> history,
    String locator,
    PipelineStep failedStep,
    FailureCategory failureCategory,
    boolean notified,
    Instant startedAt,
    Instant finishedAt,
    Instant deadline) {

  public WorkflowSnapshot {
    retryCounts = retryCounts != null ? Map.copyOf(retryCounts) : Map.of();
    history = history != null ? List.copyOf(history) : List.of();
  }
}
