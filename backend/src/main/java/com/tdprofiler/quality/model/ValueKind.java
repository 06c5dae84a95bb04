package com.tdprofiler.quality.model;

/** Tag carried by every {@link CellValue}. */
public enum ValueKind {
  INTEGER,
  FLOAT,
  BOOLEAN,
  TIMESTAMP,
  TEXT,
  MISSING;

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }
}
