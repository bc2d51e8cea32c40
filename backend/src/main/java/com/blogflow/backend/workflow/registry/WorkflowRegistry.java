package com.blogflow.backend.workflow.registry;

import com.blogflow.backend.workflow.config.PipelineProperties;
import com.blogflow.backend.workflow.domain.WorkflowSnapshot;
import com.blogflow.backend.workflow.domain.WorkflowState;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * In-memory view of running workflows and the most recently finished ones. Nothing survives a
 * restart; finished workflows beyond the configured capacity are evicted oldest first.
 */
@Component
public class WorkflowRegistry {

  private final Map<UUID, WorkflowState> running = new ConcurrentHashMap<>();
  private final LinkedHashMap<UUID, WorkflowSnapshot> finished = new LinkedHashMap<>();
  private final int historyCapacity;

  public WorkflowRegistry(PipelineProperties properties) {
    this.historyCapacity = Math.max(1, properties.getWorkflow().getHistoryCapacity());
  }

  public void register(WorkflowState state) {
    running.put(state.workflowId(), state);
  }

  public void finished(WorkflowState state) {
    WorkflowSnapshot snapshot = state.snapshot();
    synchronized (finished) {
      finished.put(snapshot.workflowId(), snapshot);
      Iterator<UUID> oldest = finished.keySet().iterator();
      while (finished.size() > historyCapacity && oldest.hasNext()) {
        oldest.next();
        oldest.remove();
      }
    }
    running.remove(state.workflowId());
  }

  public Optional<WorkflowSnapshot> find(UUID workflowId) {
    WorkflowState state = running.get(workflowId);
    if (state != null) {
      return Optional.of(state.snapshot());
    }
    synchronized (finished) {
      return Optional.ofNullable(finished.get(workflowId));
    }
  }

  /** Newest first, optionally filtered by status. */
  public List<WorkflowSnapshot> list(WorkflowStatus status, int limit) {
    Map<UUID, WorkflowSnapshot> all = new LinkedHashMap<>();
    running.values().forEach(state -> all.put(state.workflowId(), state.snapshot()));
    synchronized (finished) {
      all.putAll(finished);
    }
    return all.values().stream()
        .filter(snapshot -> status == null || snapshot.status() == status)
        .sorted(Comparator.comparing(WorkflowSnapshot::startedAt).reversed())
        .limit(Math.max(0, limit))
        .toList();
  }

  public int runningCount() {
    return running.size();
  }
}
