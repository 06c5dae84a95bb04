package com.tdprofiler.quality.service.profiling;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.dto.profile.OutlierSummary;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.TableColumn;

import lombok.RequiredArgsConstructor;

/** Static interquartile-range fences over the whole column. */
@Service
@RequiredArgsConstructor
public class OutlierDetectionService {

  private final ProfilerProperties properties;

  public OutlierSummary detectOutliers(TableColumn column) {
    if (!column.getStorageType().isNumeric()) {
      return OutlierSummary.notApplicable();
    }
    double[] sorted =
        column.nonMissing().stream().mapToDouble(CellValue::asDouble).sorted().toArray();
    if (sorted.length == 0) {
      return OutlierSummary.notApplicable();
    }

    double multiplier = properties.getIqrMultiplier();
    double q1 = Quantiles.linear(sorted, 0.25);
    double q3 = Quantiles.linear(sorted, 0.75);
    double iqr = q3 - q1;
    double lower = q1 - multiplier * iqr;
    double upper = q3 + multiplier * iqr;

    long count = 0;
    for (double value : sorted) {
      if (value < lower || value > upper) {
        count++;
      }
    }

    return OutlierSummary.builder()
        .count(count)
        .lowerBound(lower)
        .upperBound(upper)
        .threshold("IQR * " + multiplier)
        .build();
  }
}
