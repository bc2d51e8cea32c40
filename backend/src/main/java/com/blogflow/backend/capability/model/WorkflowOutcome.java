package com.blogflow.backend.capability.model;

import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import com.blogflow.backend.workflow.error.FailureCategory;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Terminal result handed to the {@code UserNotifier}. Failure outcomes carry a short, user-safe
 * reason and never any exception text.
 */
public record WorkflowOutcome(
    UUID workflowId,
    String userId,
    WorkflowStatus status,
    String title,
    String locator,
    List<String> tags,
    int hostedMedia,
    int droppedMedia,
    PipelineStep failedStep,
    FailureCategory failureCategory,
    String failureReason,
    int attempts,
    Duration elapsed) {

  public WorkflowOutcome {
    Objects.requireNonNull(workflowId, "workflowId");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(status, "status");
    tags = tags != null ? List.copyOf(tags) : List.of();
    elapsed = elapsed != null ? elapsed : Duration.ZERO;
  }

  public static WorkflowOutcome succeeded(
      UUID workflowId,
      String userId,
      Draft draft,
      PublishedPost post,
      MediaResolution media,
      Duration elapsed) {
    MediaResolution resolved = media != null ? media : MediaResolution.none();
    return new WorkflowOutcome(
        workflowId,
        userId,
        WorkflowStatus.SUCCEEDED,
        draft.title(),
        post.locator(),
        draft.tags(),
        resolved.hosted().size(),
        resolved.dropped().size(),
        null,
        null,
        null,
        0,
        elapsed);
  }

  public static WorkflowOutcome failed(
      UUID workflowId,
      String userId,
      PipelineStep failedStep,
      FailureCategory category,
      String reason,
      int attempts,
      Duration elapsed) {
    return new WorkflowOutcome(
        workflowId,
        userId,
        WorkflowStatus.FAILED,
        null,
        null,
        List.of(),
        0,
        0,
        failedStep,
        category,
        reason,
        attempts,
        elapsed);
  }

  public boolean isSuccess() {
    return status == WorkflowStatus.SUCCEEDED;
  }
}
