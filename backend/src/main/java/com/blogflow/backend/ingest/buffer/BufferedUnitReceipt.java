package com.blogflow.backend.ingest.buffer;

import java.time.Instant;
import java.util.UUID;

public record BufferedUnitReceipt(
    UUID unitId, String userId, long batchId, int pendingUnits, Instant flushDueAt) {}
