package com.tdprofiler.quality.dto.job;

import com.fasterxml.jackson.annotation.JsonValue;

public enum JobStatus {
  PROCESSING("processing"),
  COMPLETED("completed"),
  FAILED("failed");

  private final String label;

  JobStatus(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
