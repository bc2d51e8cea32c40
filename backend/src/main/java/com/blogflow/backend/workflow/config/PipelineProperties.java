package com.blogflow.backend.workflow.config;

import com.blogflow.backend.workflow.error.BackoffMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app.pipeline")
public class PipelineProperties {

  @Valid @NotNull private final Buffer buffer = new Buffer();

  @Valid @NotNull private final Retry retry = new Retry();

  @Valid @NotNull private final Step step = new Step();

  @Valid @NotNull private final Media media = new Media();

  @Valid @NotNull private final Workflow workflow = new Workflow();

  public Buffer getBuffer() {
    return buffer;
  }

  public Retry getRetry() {
    return retry;
  }

  public Step getStep() {
    return step;
  }

  public Media getMedia() {
    return media;
  }

  public Workflow getWorkflow() {
    return workflow;
  }

  public static class Buffer {

    /** Quiet period after the last unit before a batch is flushed. Required. */
    @NotNull private Duration debounceWindow;

    private boolean drainOnShutdown = true;

    public Duration getDebounceWindow() {
      return debounceWindow;
    }

    public void setDebounceWindow(Duration debounceWindow) {
      this.debounceWindow = debounceWindow;
    }

    public boolean isDrainOnShutdown() {
      return drainOnShutdown;
    }

    public void setDrainOnShutdown(boolean drainOnShutdown) {
      this.drainOnShutdown = drainOnShutdown;
    }

    @AssertTrue(message = "app.pipeline.buffer.debounce-window must be positive")
    public boolean isDebounceWindowPositive() {
      return debounceWindow == null || (!debounceWindow.isNegative() && !debounceWindow.isZero());
    }
  }

  public static class Retry {

    @Min(0)
    private int maxRetriesPerStep = 3;

    @NotNull private BackoffMode backoffMode = BackoffMode.FIXED;

    @NotEmpty
    private List<Duration> backoffSchedule =
        new ArrayList<>(
            List.of(Duration.ofSeconds(1), Duration.ofSeconds(5), Duration.ofSeconds(15)));

    @NotNull private Duration maxBackoff = Duration.ofMinutes(5);

    private double resourceExhaustionMultiplier = 4.0d;

    public int getMaxRetriesPerStep() {
      return maxRetriesPerStep;
    }

    public void setMaxRetriesPerStep(int maxRetriesPerStep) {
      this.maxRetriesPerStep = maxRetriesPerStep;
    }

    public BackoffMode getBackoffMode() {
      return backoffMode;
    }

    public void setBackoffMode(BackoffMode backoffMode) {
      this.backoffMode = backoffMode;
    }

    public List<Duration> getBackoffSchedule() {
      return backoffSchedule;
    }

    public void setBackoffSchedule(List<Duration> backoffSchedule) {
      this.backoffSchedule =
          backoffSchedule != null ? new ArrayList<>(backoffSchedule) : new ArrayList<>();
    }

    public Duration getMaxBackoff() {
      return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
      this.maxBackoff = maxBackoff;
    }

    public double getResourceExhaustionMultiplier() {
      return Math.max(1.0d, resourceExhaustionMultiplier);
    }

    public void setResourceExhaustionMultiplier(double resourceExhaustionMultiplier) {
      this.resourceExhaustionMultiplier = resourceExhaustionMultiplier;
    }
  }

  public static class Step {

    @NotNull private Duration timeout = Duration.ofSeconds(60);

    public Duration getTimeout() {
      return timeout;
    }

    public void setTimeout(Duration timeout) {
      if (timeout != null && !timeout.isNegative() && !timeout.isZero()) {
        this.timeout = timeout;
      }
    }
  }

  public static class Media {

    @NotNull
    private MediaUploadFailurePolicy uploadFailurePolicy = MediaUploadFailurePolicy.DEGRADE;

    public MediaUploadFailurePolicy getUploadFailurePolicy() {
      return uploadFailurePolicy;
    }

    public void setUploadFailurePolicy(MediaUploadFailurePolicy uploadFailurePolicy) {
      this.uploadFailurePolicy = uploadFailurePolicy;
    }
  }

  public static class Workflow {

    @Min(1)
    private int maxConcurrency = 4;

    /** Overrides the wall-clock cap derived from the retry and timeout settings. */
    private Duration deadline;

    @Min(1)
    private int historyCapacity = 200;

    private Duration shutdownGracePeriod = Duration.ofSeconds(30);

    public int getMaxConcurrency() {
      return Math.max(1, maxConcurrency);
    }

    public void setMaxConcurrency(int maxConcurrency) {
      this.maxConcurrency = Math.max(1, maxConcurrency);
    }

    public Duration getDeadline() {
      return deadline;
    }

    public void setDeadline(Duration deadline) {
      this.deadline = deadline;
    }

    public int getHistoryCapacity() {
      return historyCapacity;
    }

    public void setHistoryCapacity(int historyCapacity) {
      this.historyCapacity = historyCapacity;
    }

    public Duration getShutdownGracePeriod() {
      return shutdownGracePeriod;
    }

    public void setShutdownGracePeriod(Duration shutdownGracePeriod) {
      this.shutdownGracePeriod = shutdownGracePeriod;
    }
  }
}
