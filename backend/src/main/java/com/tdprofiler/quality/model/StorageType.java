package com.tdprofiler.quality.model;

/**
 * Physical representation of a column, derived from the kinds of its non-missing cells. A column
 * mixing kinds (or holding only missing cells) is stored as {@link #TEXT}.
 */
public enum StorageType {
  INTEGER,
  FLOAT,
  BOOLEAN,
  DATETIME,
  TEXT;

  public boolean isNumeric() {
    return this == INTEGER || this == FLOAT;
  }

  public boolean isText() {
    return this == TEXT;
  }

  static StorageType of(Iterable<CellValue> cells) {
    boolean seen = false;
    boolean allInteger = true;
    boolean allNumeric = true;
    boolean allBoolean = true;
    boolean allTimestamp = true;

    for (CellValue cell : cells) {
      ValueKind kind = cell.getKind();
      if (kind == ValueKind.MISSING) {
        continue;
      }
      seen = true;
      allInteger &= kind == ValueKind.INTEGER;
      allNumeric &= kind.isNumeric();
      allBoolean &= kind == ValueKind.BOOLEAN;
      allTimestamp &= kind == ValueKind.TIMESTAMP;
    }

    if (!seen) {
      return TEXT;
    }
    if (allInteger) {
      return INTEGER;
    }
    if (allNumeric) {
      return FLOAT;
    }
    if (allBoolean) {
      return BOOLEAN;
    }
    if (allTimestamp) {
      return DATETIME;
    }
    return TEXT;
  }
}
