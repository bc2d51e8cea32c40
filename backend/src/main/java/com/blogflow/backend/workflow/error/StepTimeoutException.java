package com.blogflow.backend.workflow.error;

import com.blogflow.backend.workflow.domain.PipelineStep;
import java.time.Duration;

public class StepTimeoutException extends PipelineStepException {

  private final PipelineStep step;
  private final Duration timeout;

  public StepTimeoutException(PipelineStep step, Duration timeout) {
    super("Step " + step.getCode() + " did not finish within " + timeout.toMillis() + " ms");
    this.step = step;
    this.timeout = timeout;
  }

  public PipelineStep getStep() {
    return step;
  }

  public Duration getTimeout() {
    return timeout;
  }

  @Override
  public FailureCategory category() {
    return FailureCategory.TRANSIENT_EXTERNAL;
  }
}
