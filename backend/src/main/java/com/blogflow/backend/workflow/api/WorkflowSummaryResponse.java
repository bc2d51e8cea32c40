package com.blogflow.backend.workflow.api;

import com.blogflow.backend.workflow.domain.WorkflowStage;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import java.time.Instant;
import java.util.UUID;

public record WorkflowSummaryResponse(
    UUID workflowId,
    String userId,
    long batchId,
    WorkflowStatus status,
    WorkflowStage stage,
    String locator,
    Instant startedAt,
    Instant finishedAt) {}
