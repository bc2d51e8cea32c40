package com.blogflow.backend.ingest.service;

import com.blogflow.backend.ingest.buffer.AggregationBuffer;
import com.blogflow.backend.ingest.buffer.BufferedUnitReceipt;
import com.blogflow.backend.ingest.buffer.PendingBatchView;
import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UnitKind;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Service;

/** Entry point shared by every inbound channel: normalises an event and buffers it. */
@Service
public class InboundEventService {

  private final AggregationBuffer aggregationBuffer;
  private final Clock clock;

  public InboundEventService(AggregationBuffer aggregationBuffer, Clock clock) {
    this.aggregationBuffer = Objects.requireNonNull(aggregationBuffer, "aggregationBuffer");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public BufferedUnitReceipt accept(String userId, String kind, String payload, Long timestamp) {
    UnitKind unitKind = UnitKind.fromCode(kind);
    Instant receivedAt = timestamp != null ? Instant.ofEpochMilli(timestamp) : clock.instant();
    return accept(InboundUnit.of(userId.trim(), unitKind, payload, receivedAt));
  }

  public BufferedUnitReceipt accept(InboundUnit unit) {
    return aggregationBuffer.addUnit(unit);
  }

  public List<PendingBatchView> pendingBatches() {
    return aggregationBuffer.pendingBatches();
  }
}
