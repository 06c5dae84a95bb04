package com.tdprofiler.quality.service.report;

import java.io.IOException;
import java.io.StringWriter;
import java.util.stream.Collectors;

import org.apache.commons.text.StringEscapeUtils;
import org.springframework.stereotype.Service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVWriter;
import com.tdprofiler.quality.dto.profile.ColumnProfile;
import com.tdprofiler.quality.dto.profile.DatasetProfile;
import com.tdprofiler.quality.dto.profile.DatasetSummary;
import com.tdprofiler.quality.dto.profile.IssuesSummary;
import com.tdprofiler.quality.dto.profile.QualityIssue;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Renders a finished profile as a downloadable JSON, CSV or HTML document. */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportExportService {

  static final String[] CSV_HEADER = {
    "name",
    "inferred_type",
    "semantic_type",
    "null_count",
    "null_percentage",
    "distinct_count",
    "quality_score",
    "issues"
  };

  static final String ISSUE_SEPARATOR = "; ";

  private final ObjectMapper objectMapper;

  public String export(DatasetProfile profile, ReportFormat format) throws IOException {
    log.debug("Exporting profile with {} columns as {}", profile.getColumns().size(), format);
    switch (format) {
      case JSON:
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile);
      case CSV:
        return toCsv(profile);
      case HTML:
        return toHtml(profile);
      default:
        throw new IllegalArgumentException("Unsupported report format: " + format);
    }
  }

  public String export(DatasetProfile profile, String format) throws IOException {
    return export(profile, ReportFormat.fromString(format));
  }

  private String toCsv(DatasetProfile profile) throws IOException {
    StringWriter out = new StringWriter();
    try (CSVWriter writer = new CSVWriter(out)) {
      writer.writeNext(CSV_HEADER);
      for (ColumnProfile column : profile.getColumns()) {
        writer.writeNext(
            new String[] {
              column.getName(),
              column.getInferredType().getLabel(),
              column.getSemanticType() == null ? "" : column.getSemanticType(),
              String.valueOf(column.getNullCount()),
              String.valueOf(column.getNullPercentage()),
              String.valueOf(column.getDistinctCount()),
              String.valueOf(column.getQualityScore()),
              joinIssues(column)
            });
      }
    }
    return out.toString();
  }

  private String toHtml(DatasetProfile profile) {
    DatasetSummary summary = profile.getSummary();
    IssuesSummary issues = profile.getIssuesSummary();
    StringBuilder html = new StringBuilder();

    html.append("<!DOCTYPE html>\n<html lang=\"en\">\n<head>\n")
        .append("<meta charset=\"UTF-8\">\n")
        .append("<title>Data Quality Report</title>\n")
        .append("<style>")
        .append("body{font-family:sans-serif;margin:2em;color:#222}")
        .append("table{border-collapse:collapse;margin-bottom:1.5em}")
        .append("th,td{border:1px solid #ccc;padding:4px 8px;text-align:left}")
        .append("th{background:#f3f3f3}")
        .append(".critical{color:#b00020}.warning{color:#a15c00}.info{color:#225}")
        .append("</style>\n</head>\n<body>\n")
        .append("<h1>Data Quality Report</h1>\n");

    html.append("<h2>Summary</h2>\n<table>\n");
    row(html, "Rows", String.valueOf(summary.getRowCount()));
    row(html, "Columns", String.valueOf(summary.getColumnCount()));
    row(html, "Memory estimate (MB)", String.valueOf(summary.getMemoryEstimate()));
    row(html, "Duplicate rows", String.valueOf(summary.getDuplicateRows()));
    row(html, "Quality score", String.valueOf(summary.getQualityScore()));
    row(html, "Quality grade", summary.getQualityGrade());
    html.append("</table>\n");

    html.append("<h2>Issues</h2>\n<table>\n");
    row(html, "Critical", String.valueOf(issues.getCritical()));
    row(html, "Warning", String.valueOf(issues.getWarning()));
    row(html, "Info", String.valueOf(issues.getInfo()));
    html.append("</table>\n");

    html.append("<h2>Columns</h2>\n<table>\n<tr>");
    for (String header : CSV_HEADER) {
      html.append("<th>").append(escape(header)).append("</th>");
    }
    html.append("</tr>\n");
    for (ColumnProfile column : profile.getColumns()) {
      html.append("<tr>")
          .append(cell(column.getName()))
          .append(cell(column.getInferredType().getLabel()))
          .append(cell(column.getSemanticType() == null ? "" : column.getSemanticType()))
          .append(cell(String.valueOf(column.getNullCount())))
          .append(cell(String.valueOf(column.getNullPercentage())))
          .append(cell(String.valueOf(column.getDistinctCount())))
          .append(cell(String.valueOf(column.getQualityScore())))
          .append("<td>");
      for (QualityIssue issue : column.getIssues()) {
        html.append("<div class=\"")
            .append(issue.getSeverity().getLabel())
            .append("\">")
            .append(escape(issue.getIssue()))
            .append("</div>");
      }
      html.append("</td></tr>\n");
    }
    html.append("</table>\n</body>\n</html>\n");
    return html.toString();
  }

  private static String joinIssues(ColumnProfile column) {
    return column.getIssues().stream()
        .map(QualityIssue::getIssue)
        .collect(Collectors.joining(ISSUE_SEPARATOR));
  }

  private static void row(StringBuilder html, String label, String value) {
    html.append("<tr><th>")
        .append(escape(label))
        .append("</th><td>")
        .append(escape(value))
        .append("</td></tr>\n");
  }

  private static String cell(String value) {
    return "<td>" + escape(value) + "</td>";
  }

  private static String escape(String value) {
    return StringEscapeUtils.escapeHtml4(value);
  }
}
