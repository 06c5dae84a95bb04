package com.tdprofiler.quality.service.semantic_type;

import java.util.List;
import java.util.Optional;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.TableColumn;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticTypeDetectionService {

  private final ProfilerProperties properties;
  private final SemanticTypeRegistryService registry;

  /**
   * Name of the first rule, in registry order, matching strictly more than the configured share
   * of the sampled values. Only text columns are considered.
   */
  public Optional<String> detect(TableColumn column) {
    if (!column.getStorageType().isText()) {
      return Optional.empty();
    }
    List<CellValue> sample = column.firstNonMissing(properties.getSampling().getSemanticType());
    if (sample.isEmpty()) {
      return Optional.empty();
    }

    for (SemanticTypeRule rule : registry.getRules()) {
      double ratio = matchRatio(rule, sample);
      if (ratio > properties.getSemanticMatchThreshold()) {
        log.debug(
            "Column '{}' detected as {} (match ratio {})", column.getName(), rule.getName(), ratio);
        return Optional.of(rule.getName());
      }
    }
    return Optional.empty();
  }

  static double matchRatio(SemanticTypeRule rule, List<CellValue> sample) {
    long matches = sample.stream().filter(cell -> rule.matches(cell.asText())).count();
    return (double) matches / sample.size();
  }
}
