package com.blogflow.backend.workflow.config;

public enum MediaUploadFailurePolicy {
  /** Publish without the media that could not be hosted. */
  DEGRADE,
  /** Treat any media failure as a failure of the whole upload step. */
  ABORT
}
