package com.blogflow.backend.ingest.domain;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum UnitKind {
  TEXT("text", false),
  IMAGE("image", true),
  VIDEO("video", true);

  private final String code;
  private final boolean media;

  UnitKind(String code, boolean media) {
    this.code = code;
    this.media = media;
  }

  @JsonValue
  public String getCode() {
    return code;
  }

  public boolean isMedia() {
    return media;
  }

  public static UnitKind fromCode(String code) {
    if (code == null) {
      throw new IllegalArgumentException("Unit kind must not be null");
    }
    String normalized = code.trim().toLowerCase(Locale.ROOT);
    for (UnitKind kind : values()) {
      if (kind.code.equals(normalized)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown unit kind: " + code);
  }
}
