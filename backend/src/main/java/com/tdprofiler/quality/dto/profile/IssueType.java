package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonValue;

public enum IssueType {
  COMPLETENESS("completeness"),
  VALIDITY("validity"),
  CONSISTENCY("consistency");

  private final String label;

  IssueType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }
}
