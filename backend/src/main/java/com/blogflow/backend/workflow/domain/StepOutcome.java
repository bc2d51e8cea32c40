package com.blogflow.backend.workflow.domain;

public enum StepOutcome {
  SUCCESS,
  RETRYABLE_FAILURE,
  FATAL_FAILURE
}
