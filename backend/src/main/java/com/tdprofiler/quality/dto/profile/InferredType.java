package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InferredType {
  INTEGER("integer"),
  FLOAT("float"),
  DATETIME("datetime"),
  BOOLEAN("boolean"),
  STRING("string");

  private final String label;

  InferredType(String label) {
    this.label = label;
  }

  @JsonValue
  public String getLabel() {
    return label;
  }

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }
}
