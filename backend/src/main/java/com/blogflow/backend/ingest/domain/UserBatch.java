package com.blogflow.backend.ingest.domain;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of a user's batch taken at flush time. Units keep their arrival order.
 */
public record UserBatch(
    long batchId,
    String userId,
    List<InboundUnit> units,
    Instant createdAt,
    Instant lastExtendedAt,
    Instant flushedAt) {

  public UserBatch {
    Objects.requireNonNull(userId, "userId");
    units = units != null ? List.copyOf(units) : List.of();
  }

  public List<InboundUnit> mediaUnits() {
    return units.stream().filter(InboundUnit::isMedia).toList();
  }

  public List<InboundUnit> textUnits() {
    return units.stream().filter(unit -> unit.kind() == UnitKind.TEXT).toList();
  }

  public boolean hasMedia() {
    return units.stream().anyMatch(InboundUnit::isMedia);
  }

  public int size() {
    return units.size();
  }
}
