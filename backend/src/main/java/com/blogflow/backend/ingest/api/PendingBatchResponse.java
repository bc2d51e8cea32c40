package com.blogflow.backend.ingest.api;

import java.time.Instant;

public record PendingBatchResponse(
    String userId,
    long batchId,
    int unitCount,
    int mediaCount,
    Instant createdAt,
    Instant lastExtendedAt,
    Instant flushDueAt) {}
