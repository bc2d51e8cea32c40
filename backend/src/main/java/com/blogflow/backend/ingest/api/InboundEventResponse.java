package com.blogflow.backend.ingest.api;

import java.time.Instant;
import java.util.UUID;

public record InboundEventResponse(
    UUID unitId, long batchId, int pendingUnits, Instant flushDueAt) {}
