package com.tdprofiler.quality.service.report;

import java.util.Locale;

import org.springframework.http.MediaType;

public enum ReportFormat {
  JSON("json", MediaType.APPLICATION_JSON_VALUE),
  CSV("csv", "text/csv"),
  HTML("html", MediaType.TEXT_HTML_VALUE);

  private final String extension;
  private final String contentType;

  ReportFormat(String extension, String contentType) {
    this.extension = extension;
    this.contentType = contentType;
  }

  public String getExtension() {
    return extension;
  }

  public String getContentType() {
    return contentType;
  }

  public static ReportFormat fromString(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (ReportFormat format : values()) {
        if (format.extension.equals(normalized)) {
          return format;
        }
      }
    }
    throw new IllegalArgumentException(
        "Unsupported report format: " + value + ". Supported formats: json, csv, html");
  }
}
