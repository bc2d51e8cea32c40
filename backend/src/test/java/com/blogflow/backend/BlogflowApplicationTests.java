package com.blogflow.backend;

import static org.assertj.core.api.Assertions.assertThat;

import com.blogflow.backend.capability.BlogPublisher;
import com.blogflow.backend.capability.ContentAnalyzer;
import com.blogflow.backend.capability.MediaUploader;
import com.blogflow.backend.capability.UserNotifier;
import com.blogflow.backend.ingest.service.InboundEventService;
import com.blogflow.backend.integration.fallback.ExcerptContentAnalyzer;
import com.blogflow.backend.integration.fallback.LinkMediaUploader;
import com.blogflow.backend.integration.fallback.LoggingBlogPublisher;
import com.blogflow.backend.integration.fallback.LoggingUserNotifier;
import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.StepResult;
import com.blogflow.backend.workflow.domain.WorkflowSnapshot;
import com.blogflow.backend.workflow.domain.WorkflowStage;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import com.blogflow.backend.workflow.registry.WorkflowRegistry;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(
    properties = {
      "app.pipeline.buffer.debounce-window=200ms",
      "app.pipeline.step.timeout=5s"
    })
class BlogflowApplicationTests {

  @Autowired private ContentAnalyzer contentAnalyzer;
  @Autowired private MediaUploader mediaUploader;
  @Autowired private BlogPublisher blogPublisher;
  @Autowired private UserNotifier userNotifier;
  @Autowired private InboundEventService inboundEventService;
  @Autowired private WorkflowRegistry workflowRegistry;

  @Test
  void fallbackCapabilitiesAreWiredWhenNoIntegrationIsEnabled() {
    assertThat(contentAnalyzer).isInstanceOf(ExcerptContentAnalyzer.class);
    assertThat(mediaUploader).isInstanceOf(LinkMediaUploader.class);
    assertThat(blogPublisher).isInstanceOf(LoggingBlogPublisher.class);
    assertThat(userNotifier).isInstanceOf(LoggingUserNotifier.class);
  }

  @Test
  void bufferedMessagesRunThroughWholePipeline() throws Exception {
    inboundEventService.accept("web:e2e", "text", "Sunday market #food", null);
    inboundEventService.accept("web:e2e", "image", "https://cdn.example/market.jpg", null);

    WorkflowSnapshot snapshot = awaitFinished("web:e2e");

    assertThat(snapshot.status()).isEqualTo(WorkflowStatus.SUCCEEDED);
    assertThat(snapshot.stage()).isEqualTo(WorkflowStage.NOTIFIED);
    assertThat(snapshot.unitCount()).isEqualTo(2);
    assertThat(snapshot.locator()).startsWith("dry-run:");
    assertThat(snapshot.history())
        .extracting(StepResult::step)
        .containsExactly(
            PipelineStep.ANALYZE,
            PipelineStep.GENERATE_DRAFT,
            PipelineStep.UPLOAD_MEDIA,
            PipelineStep.PUBLISH,
            PipelineStep.NOTIFY);
  }

  private WorkflowSnapshot awaitFinished(String userId) throws InterruptedException {
    for (int attempt = 0; attempt < 100; attempt++) {
      List<WorkflowSnapshot> finished =
          workflowRegistry.list(null, 50).stream()
              .filter(snapshot -> snapshot.userId().equals(userId))
              .filter(snapshot -> snapshot.status().isTerminal())
              .toList();
      if (!finished.isEmpty()) {
        return finished.get(0);
      }
      Thread.sleep(50);
    }
    throw new AssertionError("No finished workflow for " + userId);
  }
}
