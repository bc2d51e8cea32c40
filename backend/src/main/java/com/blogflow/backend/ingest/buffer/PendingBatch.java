package com.blogflow.backend.ingest.buffer;

import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UserBatch;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;

/**
 * Mutable batch owned by {@link AggregationBuffer}. Only touched from inside the buffer map's
 * per-key remapping functions.
 */
final class PendingBatch {

  private final long batchId;
  private final String userId;
  private final Instant createdAt;
  private final List<InboundUnit> units = new ArrayList<>();
  private Instant lastExtendedAt;
  private Instant flushDueAt;
  private ScheduledFuture<?> timer;
  private long timerToken;

  PendingBatch(long batchId, String userId, Instant createdAt) {
    this.batchId = batchId;
    this.userId = userId;
    this.createdAt = createdAt;
    this.lastExtendedAt = createdAt;
  }

  void append(InboundUnit unit, Instant now) {
    units.add(unit);
    lastExtendedAt = now;
  }

  void rearm(ScheduledFuture<?> timer, long timerToken, Instant flushDueAt) {
    cancelTimer();
    this.timer = timer;
    this.timerToken = timerToken;
    this.flushDueAt = flushDueAt;
  }

  void cancelTimer() {
    if (timer != null) {
      timer.cancel(false);
      timer = null;
    }
  }

  boolean isArmedWith(long token) {
    return timerToken == token;
  }

  long batchId() {
    return batchId;
  }

  int size() {
    return units.size();
  }

  UserBatch release(Instant flushedAt) {
    return new UserBatch(batchId, userId, units, createdAt, lastExtendedAt, flushedAt);
  }

  PendingBatchView view() {
    int media = (int) units.stream().filter(InboundUnit::isMedia).count();
    return new PendingBatchView(
        userId, batchId, units.size(), media, createdAt, lastExtendedAt, flushDueAt);
  }
}
