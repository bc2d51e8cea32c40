package com.blogflow.backend.workflow.engine;

import com.blogflow.backend.ingest.buffer.BatchFlushHandler;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.config.PipelineProperties;
import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

/** Takes ownership of flushed batches and runs one workflow per batch on the workflow pool. */
@Component
public class WorkflowLauncher implements BatchFlushHandler {

  private static final Logger log = LoggerFactory.getLogger(WorkflowLauncher.class);

  private final WorkflowEngine workflowEngine;
  private final ExecutorService workflowExecutor;
  private final Duration shutdownGracePeriod;

  public WorkflowLauncher(
      WorkflowEngine workflowEngine,
      @Qualifier("workflowExecutor") ExecutorService workflowExecutor,
      PipelineProperties properties) {
    this.workflowEngine = Objects.requireNonNull(workflowEngine, "workflowEngine");
    this.workflowExecutor = Objects.requireNonNull(workflowExecutor, "workflowExecutor");
    Duration grace = properties.getWorkflow().getShutdownGracePeriod();
    this.shutdownGracePeriod = grace != null ? grace : Duration.ZERO;
  }

  @Override
  public void onFlush(UserBatch batch) {
    workflowExecutor.execute(() -> run(batch));
  }

  private void run(UserBatch batch) {
    try {
      workflowEngine.execute(batch);
    } catch (RuntimeException ex) {
      log.error("Workflow for batch {} of user {} crashed", batch.batchId(), batch.userId(), ex);
    }
  }

  @PreDestroy
  public void shutdown() {
    workflowExecutor.shutdown();
    try {
      if (!workflowExecutor.awaitTermination(
          shutdownGracePeriod.toMillis(), TimeUnit.MILLISECONDS)) {
        log.warn(
            "Workflows still running after {} ms grace period, interrupting",
            shutdownGracePeriod.toMillis());
        workflowExecutor.shutdownNow();
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      workflowExecutor.shutdownNow();
    }
  }
}
