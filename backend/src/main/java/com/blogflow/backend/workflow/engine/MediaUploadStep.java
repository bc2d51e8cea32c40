package com.blogflow.backend.workflow.engine;

import com.blogflow.backend.capability.MediaUploader;
import com.blogflow.backend.capability.model.DroppedMedia;
import com.blogflow.backend.capability.model.HostedMedia;
import com.blogflow.backend.capability.model.MediaResolution;
import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.workflow.config.MediaUploadFailurePolicy;
import com.blogflow.backend.workflow.config.PipelineProperties;
import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.WorkflowState;
import com.blogflow.backend.workflow.error.FailureClassifier;
import com.blogflow.backend.workflow.error.FailureDecision;
import com.blogflow.backend.workflow.error.RetryController;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * One attempt of the upload step. Each unresolved media unit is uploaded separately; progress is
 * kept on the workflow state so a retried attempt only touches units that are still unresolved.
 *
 * <p>With {@link MediaUploadFailurePolicy#DEGRADE} a fatal upload drops that unit, and a retryable
 * one fails the attempt (after the other units were tried) unless this is the last attempt, in
 * which case the unit is dropped too. With {@link MediaUploadFailurePolicy#ABORT} the first failing
 * upload fails the attempt.
 */
@Component
public class MediaUploadStep {

  private static final Logger log = LoggerFactory.getLogger(MediaUploadStep.class);

  private final MediaUploader mediaUploader;
  private final StepInvoker stepInvoker;
  private final RetryController retryController;
  private final MediaUploadFailurePolicy policy;

  public MediaUploadStep(
      MediaUploader mediaUploader,
      StepInvoker stepInvoker,
      RetryController retryController,
      PipelineProperties properties) {
    this.mediaUploader = Objects.requireNonNull(mediaUploader, "mediaUploader");
    this.stepInvoker = Objects.requireNonNull(stepInvoker, "stepInvoker");
    this.retryController = Objects.requireNonNull(retryController, "retryController");
    this.policy = properties.getMedia().getUploadFailurePolicy();
  }

  public MediaResolution run(WorkflowState state, Duration timeout, boolean lastAttempt)
      throws Exception {
    int attempt = state.attemptsOf(PipelineStep.UPLOAD_MEDIA) + 1;
    Exception retryable = null;
    for (InboundUnit unit : state.unresolvedMedia()) {
      try {
        HostedMedia hosted =
            stepInvoker.invoke(
                PipelineStep.UPLOAD_MEDIA, timeout, () -> mediaUploader.upload(unit));
        state.mediaHosted(hosted);
      } catch (InterruptedException ex) {
        throw ex;
      } catch (ExecutionException | RuntimeException ex) {
        if (policy == MediaUploadFailurePolicy.ABORT) {
          throw ex;
        }
        FailureDecision decision =
            retryController.decide(PipelineStep.UPLOAD_MEDIA, attempt, ex);
        if (!decision.category().isRetryable() || lastAttempt) {
          log.warn(
              "Workflow {} dropping media unit {} ({}): {}",
              state.workflowId(),
              unit.id(),
              decision.category(),
              FailureClassifier.unwrap(ex).getMessage());
          state.mediaDropped(new DroppedMedia(unit.id(), decision.error()));
        } else if (retryable == null) {
          retryable = ex;
        }
      }
    }
    if (retryable != null) {
      throw retryable;
    }
    return state.currentMedia();
  }
}
