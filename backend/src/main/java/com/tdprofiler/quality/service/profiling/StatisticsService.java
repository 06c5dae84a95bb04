package com.tdprofiler.quality.service.profiling;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.dto.profile.ColumnStatistics;
import com.tdprofiler.quality.dto.profile.InferredType;
import com.tdprofiler.quality.dto.profile.TopValue;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.TableColumn;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class StatisticsService {

  private final ProfilerProperties properties;

  /**
   * Summary statistics for numeric and string columns. Other types, and columns without any
   * value, get {@link ColumnStatistics#empty()}.
   */
  public ColumnStatistics calculateStats(TableColumn column, InferredType inferredType) {
    List<CellValue> values = column.nonMissing();
    if (values.isEmpty()) {
      return ColumnStatistics.empty();
    }
    if (inferredType.isNumeric()) {
      return numericStats(values);
    }
    if (inferredType == InferredType.STRING) {
      return lengthStats(values);
    }
    return ColumnStatistics.empty();
  }

  public List<TopValue> getTopValues(TableColumn column) {
    return getTopValues(column, properties.getTopValues());
  }

  /**
   * Most frequent non-missing values, by descending count. Equal counts keep the order in which
   * the values were first seen.
   */
  public List<TopValue> getTopValues(TableColumn column, int topN) {
    if (column.size() == 0 || topN <= 0) {
      return Collections.emptyList();
    }
    Map<CellValue, Long> counts = new LinkedHashMap<>();
    for (CellValue cell : column.getCells()) {
      if (!cell.isMissing()) {
        counts.merge(cell, 1L, Long::sum);
      }
    }

    List<Map.Entry<CellValue, Long>> ranked = new ArrayList<>(counts.entrySet());
    ranked.sort(Map.Entry.<CellValue, Long>comparingByValue(Comparator.reverseOrder()));

    List<TopValue> top = new ArrayList<>(Math.min(topN, ranked.size()));
    for (Map.Entry<CellValue, Long> entry : ranked.subList(0, Math.min(topN, ranked.size()))) {
      top.add(
          TopValue.builder()
              .value(entry.getKey().asText())
              .count(entry.getValue())
              .percentage(Rounding.round(Rounding.percentage(entry.getValue(), column.size()), 2))
              .build());
    }
    return top;
  }

  private ColumnStatistics numericStats(List<CellValue> values) {
    double[] sorted = values.stream().mapToDouble(CellValue::asDouble).sorted().toArray();
    double mean = Arrays.stream(sorted).sum() / sorted.length;

    double std = 0.0;
    if (sorted.length > 1) {
      double squares = 0.0;
      for (double value : sorted) {
        squares += (value - mean) * (value - mean);
      }
      std = Math.sqrt(squares / (sorted.length - 1));
    }

    return ColumnStatistics.builder()
        .min(sorted[0])
        .max(sorted[sorted.length - 1])
        .mean(mean)
        .median(Quantiles.median(sorted))
        .std(std)
        .build();
  }

  private ColumnStatistics lengthStats(List<CellValue> values) {
    int min = Integer.MAX_VALUE;
    int max = 0;
    long total = 0;
    for (CellValue value : values) {
      String text = value.asText();
      int length = text.codePointCount(0, text.length());
      min = Math.min(min, length);
      max = Math.max(max, length);
      total += length;
    }
    return ColumnStatistics.builder()
        .minLength(min)
        .maxLength(max)
        .meanLength((double) total / values.size())
        .build();
  }
}
