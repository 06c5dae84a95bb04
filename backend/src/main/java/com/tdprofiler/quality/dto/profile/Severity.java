package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {
  CRITICAL("critical"),
  WARNING("warning"),
  INFO("info");

  private final String label;

  Severity(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
