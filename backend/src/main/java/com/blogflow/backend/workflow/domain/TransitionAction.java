package com.blogflow.backend.workflow.domain;

public enum TransitionAction {
  /** Move on to the next ordered stage. */
  ADVANCE,
  /** Stay on the stage and run the same step again after a backoff. */
  RETRY,
  /** Stop running steps; the workflow failed. */
  ABORT,
  /** Terminal notification has been attempted. */
  COMPLETE
}
