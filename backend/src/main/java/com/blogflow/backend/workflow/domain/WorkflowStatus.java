package com.blogflow.backend.workflow.domain;

public enum WorkflowStatus {
  RUNNING,
  SUCCEEDED,
  FAILED;

  public boolean isTerminal() {
    return this != RUNNING;
  }
}
