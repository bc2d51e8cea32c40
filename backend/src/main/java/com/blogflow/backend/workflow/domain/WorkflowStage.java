package com.blogflow.backend.workflow.domain;

public enum WorkflowStage {
  RECEIVED,
  ANALYZED,
  DRAFTED,
  MEDIA_RESOLVED,
  PUBLISHED,
  NOTIFIED,
  ABORTED;

  /** Stages from which the terminal notification is sent. */
  public boolean awaitsNotification() {
    return this == PUBLISHED || this == ABORTED;
  }
}
