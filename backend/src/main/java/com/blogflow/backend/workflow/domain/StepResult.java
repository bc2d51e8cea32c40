package com.blogflow.backend.workflow.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

public record StepResult(
    PipelineStep step,
    int attempt,
    StepOutcome outcome,
    Object data,
    StepError error,
    Instant startedAt,
    Instant completedAt) {

  public StepResult {
    Objects.requireNonNull(step, "step");
    Objects.requireNonNull(outcome, "outcome");
    if (attempt < 1) {
      throw new IllegalArgumentException("attempt must be positive");
    }
    if (outcome != StepOutcome.SUCCESS && error == null) {
      throw new IllegalArgumentException("failed step result requires an error");
    }
  }

  public static StepResult success(
      PipelineStep step, int attempt, Object data, Instant startedAt, Instant completedAt) {
    return new StepResult(step, attempt, StepOutcome.SUCCESS, data, null, startedAt, completedAt);
  }

  public static StepResult failure(
      PipelineStep step,
      int attempt,
      StepOutcome outcome,
      StepError error,
      Instant startedAt,
      Instant completedAt) {
    if (outcome == StepOutcome.SUCCESS) {
      throw new IllegalArgumentException("failure outcome expected");
    }
    return new StepResult(step, attempt, outcome, null, error, startedAt, completedAt);
  }

  public boolean isSuccess() {
    return outcome == StepOutcome.SUCCESS;
  }

  public Duration duration() {
    if (startedAt == null || completedAt == null) {
      return Duration.ZERO;
    }
    return Duration.between(startedAt, completedAt);
  }
}
