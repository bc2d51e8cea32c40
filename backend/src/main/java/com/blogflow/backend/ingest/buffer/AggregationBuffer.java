package com.blogflow.backend.ingest.buffer;

import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.config.PipelineProperties;
import com.blogflow.backend.workflow.telemetry.PipelineTelemetryService;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Per-user debounce buffer. Every unit for a user lands in that user's live batch and pushes the
 * batch's flush out by the debounce window. When a window passes without new units the batch is
 * removed from the map and handed to the {@link BatchFlushHandler}.
 *
 * <p>All mutation of a user's batch happens inside {@link ConcurrentMap#compute} on that user's
 * key, so appends, timer resets and the flush swap are mutually exclusive per user while different
 * users never contend. Each armed timer carries a token; a timer only flushes the batch if the
 * batch is still armed with that token, so a timer that fires after it was superseded is a no-op.
 */
@Component
public class AggregationBuffer {

  private static final Logger log = LoggerFactory.getLogger(AggregationBuffer.class);

  private final ConcurrentMap<String, PendingBatch> batches = new ConcurrentHashMap<>();
  private final AtomicLong batchSequence = new AtomicLong();
  private final AtomicLong timerSequence = new AtomicLong();
  private final Duration debounceWindow;
  private final boolean drainOnShutdown;
  private final ScheduledExecutorService scheduler;
  private final BatchFlushHandler flushHandler;
  private final Clock clock;
  private final PipelineTelemetryService telemetry;
  private volatile boolean closed;

  public AggregationBuffer(
      PipelineProperties properties,
      @Qualifier("batchFlushScheduler") ScheduledExecutorService scheduler,
      BatchFlushHandler flushHandler,
      Clock clock,
      PipelineTelemetryService telemetry) {
    this.debounceWindow =
        Objects.requireNonNull(
            properties.getBuffer().getDebounceWindow(), "app.pipeline.buffer.debounce-window");
    if (debounceWindow.isNegative() || debounceWindow.isZero()) {
      throw new IllegalArgumentException("Debounce window must be positive");
    }
    this.drainOnShutdown = properties.getBuffer().isDrainOnShutdown();
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.flushHandler = Objects.requireNonNull(flushHandler, "flushHandler");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.telemetry = Objects.requireNonNull(telemetry, "telemetry");
  }

  public BufferedUnitReceipt addUnit(InboundUnit unit) {
    Objects.requireNonNull(unit, "unit");
    if (closed) {
      throw new IllegalStateException("Aggregation buffer is shut down");
    }
    String userId = unit.userId();
    AtomicReference<BufferedUnitReceipt> receipt = new AtomicReference<>();
    batches.compute(
        userId,
        (key, current) -> {
          if (closed) {
            throw new IllegalStateException("Aggregation buffer is shut down");
          }
          Instant now = clock.instant();
          PendingBatch batch = current;
          if (batch == null) {
            batch = new PendingBatch(batchSequence.incrementAndGet(), key, now);
            log.info("Opened batch {} for user {}", batch.batchId(), key);
          }
          long token = timerSequence.incrementAndGet();
          long batchId = batch.batchId();
          ScheduledFuture<?> timer =
              scheduler.schedule(
                  () -> flush(key, batchId, token),
                  debounceWindow.toMillis(),
                  TimeUnit.MILLISECONDS);
          batch.append(unit, now);
          Instant dueAt = now.plus(debounceWindow);
          batch.rearm(timer, token, dueAt);
          receipt.set(new BufferedUnitReceipt(unit.id(), key, batchId, batch.size(), dueAt));
          return batch;
        });
    BufferedUnitReceipt result = receipt.get();
    telemetry.unitReceived(userId, unit.kind(), result.batchId(), result.pendingUnits());
    if (closed) {
      // shutdown started while this unit was being added and may have missed its batch
      releaseAfterShutdown(userId);
    }
    return result;
  }

  public List<PendingBatchView> pendingBatches() {
    List<PendingBatchView> views = new ArrayList<>();
    for (String userId : batches.keySet()) {
      batches.computeIfPresent(
          userId,
          (key, batch) -> {
            views.add(batch.view());
            return batch;
          });
    }
    views.sort(Comparator.comparing(PendingBatchView::createdAt));
    return views;
  }

  public int pendingUserCount() {
    return batches.size();
  }

  /** Releases every pending batch immediately, regardless of its timer. */
  public int flushAll() {
    int flushed = 0;
    for (String userId : List.copyOf(batches.keySet())) {
      PendingBatch batch = remove(userId);
      if (batch != null) {
        handOff(batch);
        flushed++;
      }
    }
    return flushed;
  }

  @PreDestroy
  public void shutdown() {
    closed = true;
    if (drainOnShutdown) {
      int flushed = flushAll();
      if (flushed > 0) {
        log.info("Drained {} pending batch(es) on shutdown", flushed);
      }
      return;
    }
    if (!batches.isEmpty()) {
      log.warn("Discarding {} pending batch(es) on shutdown", batches.size());
      batches.values().forEach(PendingBatch::cancelTimer);
      batches.clear();
    }
  }

  private void releaseAfterShutdown(String userId) {
    PendingBatch batch = remove(userId);
    if (batch == null) {
      return;
    }
    if (drainOnShutdown) {
      log.info("Draining batch {} for user {} added during shutdown", batch.batchId(), userId);
      handOff(batch);
      return;
    }
    log.warn("Discarding batch {} for user {} added during shutdown", batch.batchId(), userId);
    throw new IllegalStateException("Aggregation buffer is shut down");
  }

  private PendingBatch remove(String userId) {
    AtomicReference<PendingBatch> removed = new AtomicReference<>();
    batches.computeIfPresent(
        userId,
        (key, batch) -> {
          batch.cancelTimer();
          removed.set(batch);
          return null;
        });
    return removed.get();
  }

  void flush(String userId, long batchId, long token) {
    AtomicReference<PendingBatch> removed = new AtomicReference<>();
    batches.computeIfPresent(
        userId,
        (key, batch) -> {
          if (batch.batchId() != batchId || !batch.isArmedWith(token)) {
            return batch;
          }
          removed.set(batch);
          return null;
        });
    PendingBatch batch = removed.get();
    if (batch == null) {
      log.debug("Ignoring superseded timer for user {} batch {}", userId, batchId);
      return;
    }
    handOff(batch);
  }

  private void handOff(PendingBatch pending) {
    UserBatch batch = pending.release(clock.instant());
    telemetry.batchFlushed(batch);
    try {
      flushHandler.onFlush(batch);
    } catch (RuntimeException ex) {
      log.error(
          "Flush handler rejected batch {} for user {} ({} unit(s))",
          batch.batchId(),
          batch.userId(),
          batch.size(),
          ex);
    }
  }
}
