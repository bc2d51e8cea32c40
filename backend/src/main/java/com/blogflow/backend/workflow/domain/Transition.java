package com.blogflow.backend.workflow.domain;

import java.util.Objects;

public record Transition(TransitionAction action, WorkflowStage target) {

  public Transition {
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(target, "target");
  }

  public static Transition advance(WorkflowStage target) {
    return new Transition(TransitionAction.ADVANCE, target);
  }

  public static Transition retry(WorkflowStage current) {
    return new Transition(TransitionAction.RETRY, current);
  }

  public static Transition abort() {
    return new Transition(TransitionAction.ABORT, WorkflowStage.ABORTED);
  }

  public static Transition complete(WorkflowStage target) {
    return new Transition(TransitionAction.COMPLETE, target);
  }
}
