package com.tdprofiler.quality.service.data_processing;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.springframework.stereotype.Service;

import com.opencsv.CSVReader;
import com.opencsv.exceptions.CsvValidationException;
import com.tdprofiler.quality.model.DataTable;

import lombok.extern.slf4j.Slf4j;

/** Reads delimited text with a header row into a typed {@link DataTable}. */
@Slf4j
@Service
public class CsvParsingService {

  private static final String BYTE_ORDER_MARK = "\uFEFF";

  public DataTable parse(byte[] csvData, String tableName) throws IOException {
    return parse(new ByteArrayInputStream(csvData), tableName);
  }

  public DataTable parse(InputStream csvStream, String tableName) throws IOException {
    List<String> headers;
    List<List<String>> rawColumns = new ArrayList<>();
    int skipped = 0;

    try (CSVReader reader =
        new CSVReader(new InputStreamReader(csvStream, StandardCharsets.UTF_8))) {
      String[] headerRow = reader.readNext();
      if (headerRow == null || headerRow.length == 0 || isBlankLine(headerRow)) {
        throw new IllegalArgumentException("CSV file has no headers");
      }
      if (headerRow[0].startsWith(BYTE_ORDER_MARK)) {
        headerRow[0] = headerRow[0].substring(1);
      }
      headers = ColumnValueConverter.normalizeHeaders(Arrays.asList(headerRow));
      for (int i = 0; i < headers.size(); i++) {
        rawColumns.add(new ArrayList<>());
      }

      String[] row;
      while ((row = reader.readNext()) != null) {
        if (isBlankLine(row)) {
          continue;
        }
        if (row.length != headers.size()) {
          log.debug(
              "Skipping row with incorrect column count: {} vs {}", row.length, headers.size());
          skipped++;
          continue;
        }
        for (int i = 0; i < row.length; i++) {
          rawColumns.get(i).add(row[i]);
        }
      }
    } catch (CsvValidationException e) {
      throw new IllegalArgumentException("Malformed CSV: " + e.getMessage(), e);
    }

    if (skipped > 0) {
      log.warn("Skipped {} malformed rows while parsing '{}'", skipped, tableName);
    }

    DataTable.Builder builder = DataTable.builder(tableName);
    for (int i = 0; i < headers.size(); i++) {
      builder.column(headers.get(i), ColumnValueConverter.convertTextColumn(rawColumns.get(i)));
    }
    return builder.build();
  }

  private static boolean isBlankLine(String[] row) {
    return row.length == 1 && row[0].isEmpty();
  }
}
