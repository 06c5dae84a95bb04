package com.tdprofiler.quality.service.profiling;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.dto.profile.PatternFrequency;
import com.tdprofiler.quality.dto.profile.PatternSummary;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.TableColumn;

import lombok.RequiredArgsConstructor;

/**
 * Structural-mask frequencies of text columns, e.g. {@code "abc-123"} becomes {@code "aaa-999"}.
 */
@Service
@RequiredArgsConstructor
public class PatternAnalysisService {

  private final ProfilerProperties properties;

  public PatternSummary analyzePatterns(TableColumn column) {
    if (!column.getStorageType().isText()) {
      return PatternSummary.empty();
    }
    List<CellValue> sample = column.firstNonMissing(properties.getSampling().getPatterns());
    if (sample.isEmpty()) {
      return PatternSummary.empty();
    }

    Map<String, Integer> counts = new LinkedHashMap<>();
    for (CellValue cell : sample) {
      counts.merge(toMask(cell.asText()), 1, Integer::sum);
    }

    List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
    ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));

    int limit = Math.min(properties.getTopPatterns(), ranked.size());
    List<PatternFrequency> top = new ArrayList<>(limit);
    for (Map.Entry<String, Integer> entry : ranked.subList(0, limit)) {
      double frequency = (double) entry.getValue() / sample.size();
      top.add(
          PatternFrequency.builder()
              .pattern(entry.getKey())
              .percentage(Rounding.round(frequency * 100, 2))
              .build());
    }
    return PatternSummary.builder().topPatterns(top).build();
  }

  /** ASCII lowercase to {@code a}, uppercase to {@code A}, digits to {@code 9}. */
  public static String toMask(String value) {
    StringBuilder mask = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      if (c >= 'a' && c <= 'z') {
        mask.append('a');
      } else if (c >= 'A' && c <= 'Z') {
        mask.append('A');
      } else if (c >= '0' && c <= '9') {
        mask.append('9');
      } else {
        mask.append(c);
      }
    }
    return mask.toString();
  }
}
