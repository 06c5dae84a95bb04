package com.tdprofiler.quality.service.data_processing;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.regex.Pattern;

import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.ValueKind;

/**
 * Column-wise conversion of raw parser output into typed cells, following the conventions of
 * dataframe readers: null tokens become missing cells and a column is numeric or boolean only when
 * every value in it is.
 */
public final class ColumnValueConverter {

  static final Set<String> NULL_TOKENS =
      Set.of(
          "",
          "#N/A",
          "#N/A N/A",
          "#NA",
          "-1.#IND",
          "-1.#QNAN",
          "-NaN",
          "-nan",
          "1.#IND",
          "1.#QNAN",
          "<NA>",
          "N/A",
          "NA",
          "NULL",
          "NaN",
          "None",
          "n/a",
          "nan",
          "null");

  private static final Set<String> TRUE_TOKENS = Set.of("True", "TRUE", "true");
  private static final Set<String> FALSE_TOKENS = Set.of("False", "FALSE", "false");

  private static final Pattern INTEGER = Pattern.compile("[+-]?\\d+");
  private static final Pattern DECIMAL =
      Pattern.compile("[+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][+-]?\\d+)?|[+-]?(?:inf|Infinity)");

  private ColumnValueConverter() {}

  public static boolean isNullToken(String raw) {
    return raw == null || NULL_TOKENS.contains(raw);
  }

  /** Types a column of raw strings as integer, float, boolean or text, in that order. */
  public static List<CellValue> convertTextColumn(List<String> raw) {
    List<String> values = new ArrayList<>(raw.size());
    for (String value : raw) {
      values.add(isNullToken(value) ? null : value);
    }

    if (allMatch(values, ColumnValueConverter::isLong)) {
      return map(values, v -> CellValue.ofInteger(Long.parseLong(v.trim())));
    }
    if (allMatch(values, v -> DECIMAL.matcher(v.trim()).matches())) {
      return map(values, v -> CellValue.ofFloat(parseDecimal(v.trim())));
    }
    if (allMatch(values, v -> TRUE_TOKENS.contains(v) || FALSE_TOKENS.contains(v))) {
      return map(values, v -> CellValue.ofBoolean(TRUE_TOKENS.contains(v)));
    }
    return map(values, CellValue::ofText);
  }

  /** Turns a float column holding only whole numbers into an integer column. */
  public static List<CellValue> normalizeWholeNumbers(List<CellValue> cells) {
    boolean seen = false;
    for (CellValue cell : cells) {
      if (cell.isMissing()) {
        continue;
      }
      if (cell.getKind() != ValueKind.FLOAT
          || !cell.isWholeNumber()
          || Math.abs(cell.asDouble()) >= 0x1p63) {
        return cells;
      }
      seen = true;
    }
    if (!seen) {
      return cells;
    }
    List<CellValue> converted = new ArrayList<>(cells.size());
    for (CellValue cell : cells) {
      converted.add(cell.isMissing() ? cell : CellValue.ofInteger((long) cell.asDouble()));
    }
    return converted;
  }

  /**
   * Makes header names usable as column names: blank names become {@code Unnamed: <index>} and
   * repeated names get a {@code .1}, {@code .2}, ... suffix.
   */
  public static List<String> normalizeHeaders(List<String> headers) {
    List<String> names = new ArrayList<>(headers.size());
    Set<String> used = new HashSet<>();
    for (int i = 0; i < headers.size(); i++) {
      String header = headers.get(i);
      String base = header == null || header.isBlank() ? "Unnamed: " + i : header;
      String name = base;
      int suffix = 1;
      while (!used.add(name)) {
        name = base + "." + suffix++;
      }
      names.add(name);
    }
    return names;
  }

  private static boolean isLong(String value) {
    String trimmed = value.trim();
    if (!INTEGER.matcher(trimmed).matches()) {
      return false;
    }
    try {
      Long.parseLong(trimmed);
      return true;
    } catch (NumberFormatException e) {
      return false;
    }
  }

  private static double parseDecimal(String value) {
    if (value.endsWith("inf") || value.endsWith("Infinity")) {
      return value.startsWith("-") ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
    }
    return Double.parseDouble(value);
  }

  private static boolean allMatch(List<String> values, Predicate<String> test) {
    boolean seen = false;
    for (String value : values) {
      if (value == null) {
        continue;
      }
      if (!test.test(value)) {
        return false;
      }
      seen = true;
    }
    return seen;
  }

  private static List<CellValue> map(
      List<String> values, Function<String, CellValue> converter) {
    List<CellValue> cells = new ArrayList<>(values.size());
    for (String value : values) {
      cells.add(value == null ? CellValue.missing() : converter.apply(value));
    }
    return cells;
  }
}
