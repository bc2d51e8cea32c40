package com.blogflow.backend.ingest.domain;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A single message received from an end user. The payload is opaque to the buffer and the
 * workflow engine: text units carry the message text, media units carry a reference (URL or
 * channel file link) that the media uploader knows how to resolve.
 */
public record InboundUnit(
    UUID id, String userId, UnitKind kind, String payload, Instant receivedAt) {

  public InboundUnit {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(userId, "userId");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(receivedAt, "receivedAt");
    if (userId.isBlank()) {
      throw new IllegalArgumentException("userId must not be blank");
    }
    payload = payload != null ? payload : "";
  }

  public static InboundUnit of(String userId, UnitKind kind, String payload, Instant receivedAt) {
    return new InboundUnit(UUID.randomUUID(), userId, kind, payload, receivedAt);
  }

  public boolean isMedia() {
    return kind.isMedia();
  }
}
