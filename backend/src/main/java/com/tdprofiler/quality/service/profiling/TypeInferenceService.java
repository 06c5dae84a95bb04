package com.tdprofiler.quality.service.profiling;

import java.util.List;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.dto.profile.InferredType;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.TableColumn;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@Service
@RequiredArgsConstructor
public class TypeInferenceService {

  private final ProfilerProperties properties;
  private final DateParsingService dateParsingService;

  /**
   * Classifies a column. Typed storage decides directly; text storage is re-labelled as datetime
   * only when every sampled value is recognised as a date.
   */
  public InferredType inferType(TableColumn column) {
    switch (column.getStorageType()) {
      case INTEGER:
        return InferredType.INTEGER;
      case FLOAT:
        return column.nonMissing().stream().allMatch(CellValue::isWholeNumber)
            ? InferredType.INTEGER
            : InferredType.FLOAT;
      case BOOLEAN:
        return InferredType.BOOLEAN;
      case DATETIME:
        return InferredType.DATETIME;
      default:
        return isDateLike(column) ? InferredType.DATETIME : InferredType.STRING;
    }
  }

  private boolean isDateLike(TableColumn column) {
    List<CellValue> sample = column.firstNonMissing(properties.getSampling().getTypeInference());
    if (sample.isEmpty()) {
      return false;
    }
    for (CellValue cell : sample) {
      if (dateParsingService.tryParse(cell.asText()).isEmpty()) {
        return false;
      }
    }
    log.debug("Column '{}' holds date-like text", column.getName());
    return true;
  }
}
