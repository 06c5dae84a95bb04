package com.tdprofiler.quality.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/** Named, immutable sequence of cells with a storage type derived from their kinds. */
@Getter
@EqualsAndHashCode
public final class TableColumn {

  private final String name;
  private final List<CellValue> cells;
  @EqualsAndHashCode.Exclude private final StorageType storageType;

  public TableColumn(String name, List<CellValue> cells) {
    if (name == null) {
      throw new IllegalArgumentException("Column name must not be null");
    }
    List<CellValue> copy = new ArrayList<>(cells.size());
    for (CellValue cell : cells) {
      copy.add(cell == null ? CellValue.missing() : cell);
    }
    this.name = name;
    this.cells = Collections.unmodifiableList(copy);
    this.storageType = StorageType.of(this.cells);
  }

  public int size() {
    return cells.size();
  }

  public CellValue get(int row) {
    return cells.get(row);
  }

  public List<CellValue> nonMissing() {
    return firstNonMissing(Integer.MAX_VALUE);
  }

  /** The first {@code limit} non-missing cells, in row order. */
  public List<CellValue> firstNonMissing(int limit) {
    List<CellValue> sample = new ArrayList<>(Math.min(limit, cells.size()));
    for (CellValue cell : cells) {
      if (sample.size() >= limit) {
        break;
      }
      if (!cell.isMissing()) {
        sample.add(cell);
      }
    }
    return sample;
  }
}
