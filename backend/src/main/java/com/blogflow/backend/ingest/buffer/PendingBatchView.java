package com.blogflow.backend.ingest.buffer;

import java.time.Instant;

public record PendingBatchView(
    String userId,
    long batchId,
    int unitCount,
    int mediaCount,
    Instant createdAt,
    Instant lastExtendedAt,
    Instant flushDueAt) {}
