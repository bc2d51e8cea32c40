package com.blogflow.backend.workflow.config;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.backoff.Sleeper;
import org.springframework.retry.backoff.ThreadWaitSleeper;

@Configuration
@EnableConfigurationProperties(PipelineProperties.class)
public class PipelineConfiguration {

  /** Fires the per-user debounce timers. */
  @Bean(name = "batchFlushScheduler", destroyMethod = "shutdownNow")
  public ScheduledExecutorService batchFlushScheduler() {
    return Executors.newScheduledThreadPool(2, namedDaemonThreads("batch-flush-"));
  }

  /** Runs whole workflows, one thread per workflow. */
  @Bean(name = "workflowExecutor", destroyMethod = "shutdown")
  public ExecutorService workflowExecutor(PipelineProperties properties) {
    return Executors.newFixedThreadPool(
        properties.getWorkflow().getMaxConcurrency(), namedDaemonThreads("workflow-worker-"));
  }

  /** Runs individual capability calls so the workflow thread can enforce the step timeout. */
  @Bean(name = "pipelineStepExecutor", destroyMethod = "shutdownNow")
  public ExecutorService pipelineStepExecutor() {
    return Executors.newCachedThreadPool(namedDaemonThreads("pipeline-step-"));
  }

  /** Waits out retry backoffs on the workflow thread. */
  @Bean
  public Sleeper retrySleeper() {
    return new ThreadWaitSleeper();
  }

  private static ThreadFactory namedDaemonThreads(String prefix) {
    return new ThreadFactory() {
      private final AtomicInteger index = new AtomicInteger();

      @Override
      public Thread newThread(Runnable runnable) {
        Thread thread = new Thread(runnable);
        thread.setName(prefix + index.incrementAndGet());
        thread.setDaemon(true);
        return thread;
      }
    };
  }
}
