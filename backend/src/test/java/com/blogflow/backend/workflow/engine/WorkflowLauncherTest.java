package com.blogflow.backend.workflow.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.config.PipelineProperties;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class WorkflowLauncherTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  @Mock private WorkflowEngine workflowEngine;

  @Test
  void crashingWorkflowDoesNotStopLaterBatches() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    PipelineProperties properties = new PipelineProperties();
    properties.getWorkflow().setShutdownGracePeriod(Duration.ofSeconds(2));
    WorkflowLauncher launcher = new WorkflowLauncher(workflowEngine, executor, properties);
    UserBatch first = batch(1L);
    UserBatch second = batch(2L);
    when(workflowEngine.execute(any()))
        .thenThrow(new IllegalStateException("boom"))
        .thenReturn(null);

    launcher.onFlush(first);
    launcher.onFlush(second);

    verify(workflowEngine, timeout(2000)).execute(second);
    verify(workflowEngine).execute(first);
    launcher.shutdown();
    assertThat(executor.isShutdown()).isTrue();
  }

  private static UserBatch batch(long batchId) {
    InboundUnit unit = InboundUnit.of("u1", UnitKind.TEXT, "hi", T0);
    return new UserBatch(batchId, "u1", List.of(unit), T0, T0, T0);
  }
}
