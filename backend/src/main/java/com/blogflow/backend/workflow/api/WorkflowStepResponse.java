package com.blogflow.backend.workflow.api;

import com.blogflow.backend.workflow.domain.StepOutcome;
import com.blogflow.backend.workflow.error.FailureCategory;
import java.time.Instant;

public record WorkflowStepResponse(
    String step,
    int attempt,
    StepOutcome outcome,
    FailureCategory failureCategory,
    String errorType,
    Instant startedAt,
    Instant completedAt,
    long durationMs) {}
