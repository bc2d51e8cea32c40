package com.blogflow.backend.capability;

import com.blogflow.backend.capability.model.WorkflowOutcome;

/** Delivers the terminal outcome to the user. Best effort: failures are logged, never retried. */
public interface UserNotifier {

  void notify(WorkflowOutcome outcome);
}
