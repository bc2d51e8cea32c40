package com.blogflow.backend.workflow.registry;

import static org.assertj.core.api.Assertions.assertThat;

import com.blogflow.backend.ingest.domain.InboundUnit;
import com.blogflow.backend.ingest.domain.UnitKind;
import com.blogflow.backend.ingest.domain.UserBatch;
import com.blogflow.backend.workflow.config.PipelineProperties;
import com.blogflow.backend.workflow.domain.PipelineStep;
import com.blogflow.backend.workflow.domain.WorkflowSnapshot;
import com.blogflow.backend.workflow.domain.WorkflowStage;
import com.blogflow.backend.workflow.domain.WorkflowState;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import com.blogflow.backend.workflow.error.FailureCategory;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class WorkflowRegistryTest {

  private static final Instant T0 = Instant.parse("2026-03-01T10:00:00Z");

  private WorkflowRegistry registry;

  @BeforeEach
  void setUp() {
    PipelineProperties properties = new PipelineProperties();
    properties.getWorkflow().setHistoryCapacity(2);
    registry = new WorkflowRegistry(properties);
  }

  @Test
  void runningWorkflowIsVisibleUntilFinished() {
    WorkflowState state = state(1, T0);
    registry.register(state);

    assertThat(registry.runningCount()).isEqualTo(1);
    assertThat(registry.find(state.workflowId()))
        .hasValueSatisfying(
            snapshot -> assertThat(snapshot.status()).isEqualTo(WorkflowStatus.RUNNING));

    state.abort(PipelineStep.ANALYZE, FailureCategory.VALIDATION);
    state.finish(WorkflowStatus.FAILED, T0.plusSeconds(3));
    registry.finished(state);

    assertThat(registry.runningCount()).isZero();
    assertThat(registry.find(state.workflowId()))
        .hasValueSatisfying(
            snapshot -> {
              assertThat(snapshot.status()).isEqualTo(WorkflowStatus.FAILED);
              assertThat(snapshot.stage()).isEqualTo(WorkflowStage.ABORTED);
              assertThat(snapshot.finishedAt()).isEqualTo(T0.plusSeconds(3));
            });
  }

  @Test
  void evictsOldestFinishedWorkflowsBeyondCapacity() {
    WorkflowState first = finished(1, T0);
    WorkflowState second = finished(2, T0.plusSeconds(10));
    WorkflowState third = finished(3, T0.plusSeconds(20));

    assertThat(registry.find(first.workflowId())).isEmpty();
    assertThat(registry.find(second.workflowId())).isPresent();
    assertThat(registry.find(third.workflowId())).isPresent();
  }

  @Test
  void listsNewestFirstWithStatusFilter() {
    WorkflowState done = finished(1, T0);
    WorkflowState running = state(2, T0.plusSeconds(30));
    registry.register(running);

    List<WorkflowSnapshot> all = registry.list(null, 10);
    assertThat(all)
        .extracting(WorkflowSnapshot::workflowId)
        .containsExactly(running.workflowId(), done.workflowId());
    assertThat(registry.list(WorkflowStatus.RUNNING, 10))
        .extracting(WorkflowSnapshot::batchId)
        .containsExactly(2L);
    assertThat(registry.list(null, 1)).hasSize(1);
  }

  @Test
  void unknownWorkflowIsEmpty() {
    assertThat(registry.find(UUID.randomUUID())).isEmpty();
  }

  private WorkflowState finished(long batchId, Instant startedAt) {
    WorkflowState state = state(batchId, startedAt);
    registry.register(state);
    state.abort(PipelineStep.ANALYZE, FailureCategory.VALIDATION);
    state.finish(WorkflowStatus.FAILED, startedAt.plusSeconds(1));
    registry.finished(state);
    return state;
  }

  private static WorkflowState state(long batchId, Instant startedAt) {
    InboundUnit unit = InboundUnit.of("user-" + batchId, UnitKind.TEXT, "hello", startedAt);
    UserBatch batch =
        new UserBatch(batchId, unit.userId(), List.of(unit), startedAt, startedAt, startedAt);
    return new WorkflowState(UUID.randomUUID(), batch, startedAt, startedAt.plusSeconds(600));
  }
}
