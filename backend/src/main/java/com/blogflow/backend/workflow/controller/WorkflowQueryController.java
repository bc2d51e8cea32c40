package com.blogflow.backend.workflow.controller;

import com.blogflow.backend.workflow.api.WorkflowDetailResponse;
import com.blogflow.backend.workflow.api.WorkflowResponseMapper;
import com.blogflow.backend.workflow.api.WorkflowSummaryResponse;
import com.blogflow.backend.workflow.domain.WorkflowStatus;
import com.blogflow.backend.workflow.registry.WorkflowRegistry;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

@RestController
@RequestMapping("/api/workflows")
public class WorkflowQueryController {

  private static final int MAX_LIMIT = 500;

  private final WorkflowRegistry workflowRegistry;

  public WorkflowQueryController(WorkflowRegistry workflowRegistry) {
    this.workflowRegistry = workflowRegistry;
  }

  @GetMapping
  public List<WorkflowSummaryResponse> list(
      @RequestParam(name = "status", required = false) String status,
      @RequestParam(name = "limit", defaultValue = "50") int limit) {
    WorkflowStatus filter = parseStatus(status);
    int boundedLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
    return workflowRegistry.list(filter, boundedLimit).stream()
        .map(WorkflowResponseMapper::toSummary)
        .toList();
  }

  @GetMapping("/{workflowId}")
  public WorkflowDetailResponse get(@PathVariable UUID workflowId) {
    return workflowRegistry
        .find(workflowId)
        .map(WorkflowResponseMapper::toDetail)
        .orElseThrow(
            () ->
                new ResponseStatusException(
                    HttpStatus.NOT_FOUND, "Workflow not found: " + workflowId));
  }

  private WorkflowStatus parseStatus(String status) {
    if (status == null || status.isBlank()) {
      return null;
    }
    try {
      return WorkflowStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Unknown status: " + status, ex);
    }
  }
}
