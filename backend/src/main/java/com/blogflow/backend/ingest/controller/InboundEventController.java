package com.blogflow.backend.ingest.controller;

import com.blogflow.backend.ingest.api.InboundEventRequest;
import com.blogflow.backend.ingest.api.InboundEventResponse;
import com.blogflow.backend.ingest.api.PendingBatchResponse;
import com.blogflow.backend.ingest.buffer.BufferedUnitReceipt;
import com.blogflow.backend.ingest.service.InboundEventService;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class InboundEventController {

  private final InboundEventService inboundEventService;

  public InboundEventController(InboundEventService inboundEventService) {
    this.inboundEventService = inboundEventService;
  }

  @PostMapping("/inbound/events")
  @ResponseStatus(HttpStatus.ACCEPTED)
  public InboundEventResponse accept(@Valid @RequestBody InboundEventRequest request) {
    BufferedUnitReceipt receipt =
        inboundEventService.accept(
            request.userId(), request.kind(), request.payload(), request.timestamp());
    return new InboundEventResponse(
        receipt.unitId(), receipt.batchId(), receipt.pendingUnits(), receipt.flushDueAt());
  }

  @GetMapping("/buffer")
  public List<PendingBatchResponse> pendingBatches() {
    return inboundEventService.pendingBatches().stream()
        .map(
            view ->
                new PendingBatchResponse(
                    view.userId(),
                    view.batchId(),
                    view.unitCount(),
                    view.mediaCount(),
                    view.createdAt(),
                    view.lastExtendedAt(),
                    view.flushDueAt()))
        .toList();
  }
}
