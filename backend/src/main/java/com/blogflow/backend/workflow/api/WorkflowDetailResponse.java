package com.blogflow.backend.workflow.api;

import com.blogflow.backend.workflow.domain.WorkflowStage;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import com.blogflow.backend.workflow.error.FailureCategory;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record WorkflowDetailResponse(
    UUID workflowId,
    String userId,
    long batchId,
    int unitCount,
    WorkflowStatus status,
    WorkflowStage stage,
    String currentStep,
    String retryingStep,
    Map<String, Integer> retryCounts,
    List<WorkflowStepResponse> history,
    String locator,
    String failedStep,
    FailureCategory failureCategory,
    boolean notified,
    Instant startedAt,
    Instant finishedAt,
    Instant deadline) {}
