package com.blogflow.backend.workflow.error;

import com.blogflow.backend.workflow.domain.StepError;
import com.blogflow.backend.workflow.domain.StepOutcome;

public record FailureDecision(StepOutcome outcome, StepError error) {

  public FailureCategory category() {
    return error.category();
  }
}
