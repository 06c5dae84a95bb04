package com.tdprofiler.quality.service.profiling;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.dto.profile.CompletenessResult;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.TableColumn;

@Service
public class CompletenessService {

  public CompletenessResult analyze(TableColumn column) {
    long nullCount = 0;
    long emptyStrings = 0;
    boolean textual = column.getStorageType().isText();

    for (CellValue cell : column.getCells()) {
      if (cell.isMissing()) {
        nullCount++;
      } else if (textual && cell.isEmptyText()) {
        emptyStrings++;
      }
    }

    return CompletenessResult.builder()
        .nullCount(nullCount)
        .nullPercentage(Rounding.percentage(nullCount, column.size()))
        .emptyStringCount(emptyStrings)
        .build();
  }
}
