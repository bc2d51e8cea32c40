package com.blogflow.backend.workflow.engine;

import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.error.StepTimeoutException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/**
 * Runs a single capability call on the step executor and waits at most the given timeout. A call
 * that overruns is interrupted and reported as a {@link StepTimeoutException}.
 */
@Component
public class StepInvoker {

  private final ExecutorService stepExecutor;

  public StepInvoker(@Qualifier("pipelineStepExecutor") ExecutorService stepExecutor) {
    this.stepExecutor = Objects.requireNonNull(stepExecutor, "stepExecutor");
  }

  public <T> T invoke(PipelineStep step, Duration timeout, Callable<T> call)
      throws ExecutionException, InterruptedException {
    Future<T> future = stepExecutor.submit(call);
    try {
      return future.get(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      future.cancel(true);
      throw new StepTimeoutException(step, timeout);
    } catch (InterruptedException ex) {
      future.cancel(true);
      throw ex;
    }
  }
}
