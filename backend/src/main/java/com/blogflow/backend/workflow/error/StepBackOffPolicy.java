package com.blogflow.backend.workflow.error;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.springframework.retry.RetryContext;
import org.springframework.retry.backoff.BackOffContext;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.SleepingBackOffPolicy;
import org.springframework.retry.backoff.ThreadWaitSleeper;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

/**
 * Backoff between attempts of one pipeline step. The retry context carries the 1-based retry
 * number under {@link #RETRY_NUMBER_ATTRIBUTE} and the category of the failure being retried under
 * {@link #CATEGORY_ATTRIBUTE}; rate-limit failures wait on the elevated tier. Every delay is capped
 * at the maximum backoff.
 */
public class StepBackOffPolicy implements SleepingBackOffPolicy<StepBackOffPolicy> {

  public static final String RETRY_NUMBER_ATTRIBUTE = "pipeline.retryNumber";
  public static final String CATEGORY_ATTRIBUTE = "pipeline.failureCategory";

  private final BackoffMode mode;
  private final List<Duration> schedule;
  private final Duration maxBackoff;
  private final double elevatedMultiplier;
  private final Sleeper sleeper;

  public StepBackOffPolicy(
      BackoffMode mode, List<Duration> schedule, Duration maxBackoff, double elevatedMultiplier) {
    this(mode, schedule, maxBackoff, elevatedMultiplier, new ThreadWaitSleeper());
  }

  private StepBackOffPolicy(
      BackoffMode mode,
      List<Duration> schedule,
      Duration maxBackoff,
      double elevatedMultiplier,
      Sleeper sleeper) {
    this.mode = mode != null ? mode : BackoffMode.FIXED;
    this.schedule =
        schedule == null || schedule.isEmpty() ? List.of(Duration.ZERO) : List.copyOf(schedule);
    this.maxBackoff = maxBackoff;
    this.elevatedMultiplier = elevatedMultiplier;
    this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
  }

  @Override
  public StepBackOffPolicy withSleeper(Sleeper sleeper) {
    return new StepBackOffPolicy(mode, schedule, maxBackoff, elevatedMultiplier, sleeper);
  }

  @Override
  public BackOffContext start(RetryContext context) {
    Object retryNumber = context.getAttribute(RETRY_NUMBER_ATTRIBUTE);
    FailureCategory category = (FailureCategory) context.getAttribute(CATEGORY_ATTRIBUTE);
    int n = retryNumber instanceof Integer number ? number : context.getRetryCount();
    return new StepBackOffContext(delay(category, n));
  }

  @Override
  public void backOff(BackOffContext backOffContext) throws BackOffInterruptedException {
    Duration delay = ((StepBackOffContext) backOffContext).delay();
    if (delay.isZero()) {
      return;
    }
    try {
      sleeper.sleep(delay.toMillis());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new BackOffInterruptedException("Interrupted while backing off", ex);
    }
  }

  /** Delay before the {@code retryNumber}-th retry (1-based) of a step. */
  public Duration delay(FailureCategory category, int retryNumber) {
    int n = Math.max(1, retryNumber);
    long millis = mode == BackoffMode.EXPONENTIAL ? exponential(n) : fixed(n);
    if (category == FailureCategory.RESOURCE_EXHAUSTION) {
      millis = Math.round(millis * elevatedMultiplier);
    }
    if (maxBackoff != null) {
      millis = Math.min(millis, maxBackoff.toMillis());
    }
    return Duration.ofMillis(Math.max(0L, millis));
  }

  private long fixed(int n) {
    return schedule.get(Math.min(n, schedule.size()) - 1).toMillis();
  }

  private long exponential(int n) {
    ExponentialBackOff backOff = new ExponentialBackOff(schedule.get(0).toMillis(), 2.0d);
    if (maxBackoff != null) {
      backOff.setMaxInterval(maxBackoff.toMillis());
    }
    BackOffExecution execution = backOff.start();
    long interval = 0L;
    for (int i = 0; i < n; i++) {
      long next = execution.nextBackOff();
      if (next == BackOffExecution.STOP) {
        break;
      }
      interval = next;
    }
    return interval;
  }

  record StepBackOffContext(Duration delay) implements BackOffContext {}
}
