package com.blogflow.backend.workflow.domain;

public enum PipelineStep {
  ANALYZE("analyze"),
  GENERATE_DRAFT("generate_draft"),
  UPLOAD_MEDIA("upload_media"),
  PUBLISH("publish"),
  NOTIFY("notify");

  private final String code;

  PipelineStep(String code) {
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
