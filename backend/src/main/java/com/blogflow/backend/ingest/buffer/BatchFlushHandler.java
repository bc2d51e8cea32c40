package com.blogflow.backend.ingest.buffer;

import com.blogflow.backend.ingest.domain.UserBatch;

/** Receives a batch once the buffer has released it. Called without any buffer lock held. */
@FunctionalInterface
public interface BatchFlushHandler {

  void onFlush(UserBatch batch);
}
