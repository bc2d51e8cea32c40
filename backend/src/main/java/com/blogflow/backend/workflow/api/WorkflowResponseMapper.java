package com.blogflow.backend.workflow.api;

import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.StepResult;
import com.blogflow.backend.workflow.domain.WorkflowSnapshot;
import java.util.LinkedHashMap;
import java.util.Map;

public final class WorkflowResponseMapper {

  private WorkflowResponseMapper() {}

  public static WorkflowSummaryResponse toSummary(WorkflowSnapshot snapshot) {
    return new WorkflowSummaryResponse(
        snapshot.workflowId(),
        snapshot.userId(),
        snapshot.batchId(),
        snapshot.status(),
        snapshot.stage(),
        snapshot.locator(),
        snapshot.startedAt(),
        snapshot.finishedAt());
  }

  public static WorkflowDetailResponse toDetail(WorkflowSnapshot snapshot) {
    Map<String, Integer> retryCounts = new LinkedHashMap<>();
    for (PipelineStep step : PipelineStep.values()) {
      Integer count = snapshot.retryCounts().get(step);
      if (count != null) {
        retryCounts.put(step.getCode(), count);
      }
    }
    return new WorkflowDetailResponse(
        snapshot.workflowId(),
        snapshot.userId(),
        snapshot.batchId(),
        snapshot.unitCount(),
        snapshot.status(),
        snapshot.stage(),
        code(snapshot.currentStep()),
        code(snapshot.retryingStep()),
        retryCounts,
        snapshot.history().stream().map(WorkflowResponseMapper::toStep).toList(),
        snapshot.locator(),
        code(snapshot.failedStep()),
        snapshot.failureCategory(),
        snapshot.notified(),
        snapshot.startedAt(),
        snapshot.finishedAt(),
        snapshot.deadline());
  }

  static WorkflowStepResponse toStep(StepResult result) {
    return new WorkflowStepResponse(
        result.step().getCode(),
        result.attempt(),
        result.outcome(),
        result.error() != null ? result.error().category() : null,
        result.error() != null ? result.error().errorType() : null,
        result.startedAt(),
        result.completedAt(),
        result.duration().toMillis());
  }

  private static String code(PipelineStep step) {
    return step != null ? step.getCode() : null;
  }
}
