package com.blogflow.backend.workflow.engine;

import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.StepOutcome;
import com.blogflow.backend.workflow.domain.Transition;
import com.blogflow.backend.workflow.domain.WorkflowStage;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Explicit state machine of the pipeline: which step runs in each non-terminal stage and where
 * each step outcome leads. The retry budget is not part of the table; the engine downgrades a
 * {@code RETRY} to an abort once the budget is spent.
 *
 * <pre>
 * RECEIVED       --analyze-->        ANALYZED
 * ANALYZED       --generate_draft--> DRAFTED
 * DRAFTED        --upload_media-->   MEDIA_RESOLVED   (skipped when the batch has no media)
 * MEDIA_RESOLVED --publish-->        PUBLISHED
 * PUBLISHED      --notify-->         NOTIFIED
 * ABORTED        --notify-->         ABORTED
 * </pre>
 */
@Component
public class WorkflowTransitionTable {

  private final Map<WorkflowStage, PipelineStep> stepByStage = new EnumMap<>(WorkflowStage.class);
  private final Map<WorkflowStage, Map<StepOutcome, Transition>> transitions =
      new EnumMap<>(WorkflowStage.class);

  public WorkflowTransitionTable() {
    working(WorkflowStage.RECEIVED, PipelineStep.ANALYZE, WorkflowStage.ANALYZED);
    working(WorkflowStage.ANALYZED, PipelineStep.GENERATE_DRAFT, WorkflowStage.DRAFTED);
    working(WorkflowStage.DRAFTED, PipelineStep.UPLOAD_MEDIA, WorkflowStage.MEDIA_RESOLVED);
    working(WorkflowStage.MEDIA_RESOLVED, PipelineStep.PUBLISH, WorkflowStage.PUBLISHED);
    notifying(WorkflowStage.PUBLISHED, WorkflowStage.NOTIFIED);
    notifying(WorkflowStage.ABORTED, WorkflowStage.ABORTED);
  }

  public PipelineStep stepFor(WorkflowStage stage) {
    PipelineStep step = stepByStage.get(stage);
    if (step == null) {
      throw new IllegalStateException("No step runs in stage " + stage);
    }
    return step;
  }

  public Transition resolve(WorkflowStage stage, StepOutcome outcome) {
    Map<StepOutcome, Transition> row = transitions.get(stage);
    if (row == null) {
      throw new IllegalStateException("Stage " + stage + " is terminal");
    }
    return row.get(outcome);
  }

  /** Whether the stage runs a pipeline step that may be retried. */
  public boolean isWorkingStage(WorkflowStage stage) {
    return transitions.containsKey(stage) && !stage.awaitsNotification();
  }

  public Map<WorkflowStage, Map<StepOutcome, Transition>> asMap() {
    return Collections.unmodifiableMap(transitions);
  }

  private void working(WorkflowStage stage, PipelineStep step, WorkflowStage next) {
    Map<StepOutcome, Transition> row = new EnumMap<>(StepOutcome.class);
    row.put(StepOutcome.SUCCESS, Transition.advance(next));
    row.put(StepOutcome.RETRYABLE_FAILURE, Transition.retry(stage));
    row.put(StepOutcome.FATAL_FAILURE, Transition.abort());
    stepByStage.put(stage, step);
    transitions.put(stage, Collections.unmodifiableMap(row));
  }

  private void notifying(WorkflowStage stage, WorkflowStage next) {
    Map<StepOutcome, Transition> row = new EnumMap<>(StepOutcome.class);
    for (StepOutcome outcome : StepOutcome.values()) {
      row.put(outcome, Transition.complete(next));
    }
    stepByStage.put(stage, PipelineStep.NOTIFY);
    transitions.put(stage, Collections.unmodifiableMap(row));
  }
}
