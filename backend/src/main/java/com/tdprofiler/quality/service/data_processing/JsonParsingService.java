package com.tdprofiler.quality.service.data_processing;

import java.io.IOException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.DataTable;
import com.tdprofiler.quality.model.ValueKind;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Reads JSON tables. Accepted layouts: an array of records, an object mapping each column to an
 * array of values, or an object mapping each column to an {@code {index: value}} object.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JsonParsingService {

  private static final DateTimeFormatter SPACE_SEPARATED =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss[.SSSSSS][.SSS]");

  private static final List<Function<String, LocalDateTime>> ISO_LAYOUTS =
      List.of(
          LocalDateTime::parse,
          text ->
              OffsetDateTime.parse(text)
                  .withOffsetSameInstant(ZoneOffset.UTC)
                  .toLocalDateTime(),
          text -> LocalDateTime.parse(text, SPACE_SEPARATED),
          text -> LocalDate.parse(text).atStartOfDay());

  private final ObjectMapper objectMapper;

  public DataTable parse(byte[] jsonData, String tableName) throws IOException {
    JsonNode root = objectMapper.readTree(jsonData);
    if (root == null || root.isMissingNode()) {
      throw new IllegalArgumentException("JSON file is empty");
    }

    Map<String, List<CellValue>> columns;
    if (root.isArray()) {
      columns = fromRecords(root);
    } else if (root.isObject()) {
      columns = fromColumns(root);
    } else {
      throw new IllegalArgumentException("JSON table must be an array or an object");
    }

    DataTable.Builder builder = DataTable.builder(tableName);
    columns.forEach(
        (name, cells) ->
            builder.column(name, isDateLikeName(name) ? convertDates(name, cells) : cells));
    return builder.build();
  }

  private Map<String, List<CellValue>> fromRecords(JsonNode records) {
    Map<String, List<CellValue>> columns = new LinkedHashMap<>();
    int row = 0;
    for (JsonNode record : records) {
      if (!record.isObject()) {
        throw new IllegalArgumentException("JSON records must be objects");
      }
      Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        List<CellValue> cells = columns.get(field.getKey());
        if (cells == null) {
          cells = new ArrayList<>();
          for (int i = 0; i < row; i++) {
            cells.add(CellValue.missing());
          }
          columns.put(field.getKey(), cells);
        }
        cells.add(toCell(field.getValue()));
      }
      row++;
      for (List<CellValue> cells : columns.values()) {
        if (cells.size() < row) {
          cells.add(CellValue.missing());
        }
      }
    }
    return columns;
  }

  private Map<String, List<CellValue>> fromColumns(JsonNode object) {
    Map<String, List<CellValue>> columns = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> field = fields.next();
      JsonNode values = field.getValue();
      if (!values.isArray() && !values.isObject()) {
        throw new IllegalArgumentException(
            "Column '" + field.getKey() + "' must hold an array or an object of values");
      }
      List<CellValue> cells = new ArrayList<>(values.size());
      values.elements().forEachRemaining(value -> cells.add(toCell(value)));
      columns.put(field.getKey(), cells);
    }
    return columns;
  }

  static CellValue toCell(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return CellValue.missing();
    }
    if (node.isIntegralNumber()) {
      return node.canConvertToLong()
          ? CellValue.ofInteger(node.longValue())
          : CellValue.ofFloat(node.doubleValue());
    }
    if (node.isNumber()) {
      return CellValue.ofFloat(node.doubleValue());
    }
    if (node.isBoolean()) {
      return CellValue.ofBoolean(node.booleanValue());
    }
    if (node.isTextual()) {
      return CellValue.ofText(node.textValue());
    }
    return CellValue.ofText(node.toString());
  }

  /** Column names that dataframe readers treat as dates by default. */
  static boolean isDateLikeName(String name) {
    String lower = name.toLowerCase(Locale.ROOT);
    return lower.endsWith("_at")
        || lower.endsWith("_time")
        || lower.startsWith("timestamp")
        || lower.equals("modified")
        || lower.equals("date")
        || lower.equals("datetime");
  }

  private List<CellValue> convertDates(String name, List<CellValue> cells) {
    List<CellValue> converted = new ArrayList<>(cells.size());
    boolean seen = false;
    for (CellValue cell : cells) {
      if (cell.isMissing()) {
        converted.add(cell);
        continue;
      }
      if (cell.getKind() != ValueKind.TEXT) {
        return cells;
      }
      Optional<LocalDateTime> parsed = parseIsoDate(cell.asText());
      if (parsed.isEmpty()) {
        return cells;
      }
      converted.add(CellValue.ofTimestamp(parsed.get()));
      seen = true;
    }
    if (seen) {
      log.debug("Converted JSON column '{}' to timestamps", name);
      return converted;
    }
    return cells;
  }

  static Optional<LocalDateTime> parseIsoDate(String value) {
    String text = value.trim();
    for (Function<String, LocalDateTime> layout : ISO_LAYOUTS) {
      try {
        return Optional.of(layout.apply(text));
      } catch (DateTimeParseException e) {
        log.trace("'{}' is not in this layout: {}", text, e.getMessage());
      }
    }
    return Optional.empty();
  }
}
