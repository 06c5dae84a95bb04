package com.tdprofiler.quality.service.data_processing;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.model.DataTable;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Picks the parser for an uploaded file by its extension. */
@Slf4j
@Service
@RequiredArgsConstructor
public class FileParsingService {

  public static final Set<String> SUPPORTED_EXTENSIONS = Set.of("csv", "json", "xlsx", "xls");

  private final CsvParsingService csvParsingService;
  private final JsonParsingService jsonParsingService;
  private final ExcelParsingService excelParsingService;

  public DataTable parse(byte[] content, String fileName) throws IOException {
    String extension = extensionOf(fileName);
    String tableName = extractTableName(fileName);
    log.debug("Parsing '{}' as {}", fileName, extension);

    switch (extension) {
      case "csv":
        return csvParsingService.parse(content, tableName);
      case "json":
        return jsonParsingService.parse(content, tableName);
      case "xlsx":
      case "xls":
        return excelParsingService.parse(content, tableName);
      default:
        throw new IllegalArgumentException("Unsupported file format: " + fileName);
    }
  }

  public static boolean isSupported(String fileName) {
    return SUPPORTED_EXTENSIONS.contains(extensionOf(fileName));
  }

  static String extensionOf(String fileName) {
    if (fileName == null) {
      return "";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return lastDotIndex >= 0 ? fileName.substring(lastDotIndex + 1).toLowerCase(Locale.ROOT) : "";
  }

  static String extractTableName(String fileName) {
    if (fileName == null || fileName.isEmpty()) {
      return "unnamed_table";
    }
    int lastDotIndex = fileName.lastIndexOf('.');
    return lastDotIndex > 0 ? fileName.substring(0, lastDotIndex) : fileName;
  }
}
