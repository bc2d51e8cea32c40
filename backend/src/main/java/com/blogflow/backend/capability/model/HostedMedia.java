package com.blogflow.backend.capability.model;

import com.blogflow.backend.ingest.domain.UnitKind;
import java.util.Objects;
import java.util.UUID;

/**
 * Externally addressable copy of a media unit. {@code deleteHandle} is whatever the host needs to
 * remove the media later and may be null.
 */
public record HostedMedia(UUID unitId, UnitKind kind, String url, String deleteHandle) {

  public HostedMedia {
    Objects.requireNonNull(unitId, "unitId");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(url, "url");
  }
}
