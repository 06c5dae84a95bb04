package com.tdprofiler.quality.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import lombok.Getter;

/**
 * Immutable in-memory columnar table: uniquely named columns sharing one row count.
 *
 * <p>Instances are produced by the file parsers or from JSON records and handed to the profiling
 * engine, which never mutates them.
 */
@Getter
public final class DataTable {

  private final String name;
  private final List<TableColumn> columns;
  private final int rowCount;

  private DataTable(String name, List<TableColumn> columns) {
    Set<String> names = new HashSet<>();
    int rows = columns.isEmpty() ? 0 : columns.get(0).size();
    for (TableColumn column : columns) {
      if (!names.add(column.getName())) {
        throw new IllegalArgumentException("Duplicate column name: " + column.getName());
      }
      if (column.size() != rows) {
        throw new IllegalArgumentException(
            String.format(
                "Column '%s' has %d rows, expected %d", column.getName(), column.size(), rows));
      }
    }
    this.name = name;
    this.columns = Collections.unmodifiableList(new ArrayList<>(columns));
    this.rowCount = rows;
  }

  public static DataTable of(String name, List<TableColumn> columns) {
    return new DataTable(name, columns);
  }

  /**
   * Builds a table from row records keyed by column name. Keys absent from a record become
   * missing cells; keys not listed in {@code columnNames} are ignored.
   */
  public static DataTable fromRecords(
      String name, List<String> columnNames, List<? extends Map<String, ?>> records) {
    List<TableColumn> columns = new ArrayList<>(columnNames.size());
    for (String columnName : columnNames) {
      List<CellValue> cells = new ArrayList<>(records.size());
      for (Map<String, ?> record : records) {
        cells.add(record == null ? CellValue.missing() : CellValue.of(record.get(columnName)));
      }
      columns.add(new TableColumn(columnName, cells));
    }
    return new DataTable(name, columns);
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public int getColumnCount() {
    return columns.size();
  }

  public boolean isEmpty() {
    return columns.isEmpty();
  }

  public Optional<TableColumn> getColumn(String columnName) {
    return columns.stream().filter(c -> c.getName().equals(columnName)).findFirst();
  }

  public List<String> getColumnNames() {
    List<String> names = new ArrayList<>(columns.size());
    columns.forEach(c -> names.add(c.getName()));
    return names;
  }

  /** Cells of one row, in column order. */
  public List<CellValue> row(int index) {
    List<CellValue> row = new ArrayList<>(columns.size());
    for (TableColumn column : columns) {
      row.add(column.get(index));
    }
    return row;
  }

  /** Collects columns in declaration order. */
  public static final class Builder {
    private final String name;
    private final Map<String, List<CellValue>> columns = new LinkedHashMap<>();

    private Builder(String name) {
      this.name = name;
    }

    public Builder column(String columnName, List<CellValue> cells) {
      if (columns.put(columnName, cells) != null) {
        throw new IllegalArgumentException("Duplicate column name: " + columnName);
      }
      return this;
    }

    public Builder column(String columnName, Object... values) {
      List<CellValue> cells = new ArrayList<>(values.length);
      for (Object value : values) {
        cells.add(CellValue.of(value));
      }
      return column(columnName, cells);
    }

    public DataTable build() {
      List<TableColumn> built = new ArrayList<>(columns.size());
      columns.forEach((columnName, cells) -> built.add(new TableColumn(columnName, cells)));
      return new DataTable(name, built);
    }
  }
}
