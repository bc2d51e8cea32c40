package com.blogflow.backend.workflow.error;

public enum BackoffMode {
  /** Retry n waits for the n-th configured delay, the last one repeating. */
  FIXED,
  /** Retry n waits for the first configured delay doubled n - 1 times. */
  EXPONENTIAL
}
