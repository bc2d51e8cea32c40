package com.blogflow.backend.capability;

import com.blogflow.backend.capability.model.DraftSeed;
import com.blogflow.backend.ingest.domain.UserBatch;

/** Derives the topic, summary and tags of a post from the aggregated units. */
public interface ContentAnalyzer {

  DraftSeed analyze(UserBatch batch);
}
