package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class DatasetSummary {

  @JsonProperty("row_count")
  int rowCount;

  @JsonProperty("column_count")
  int columnCount;

  /** Estimated in-memory size of the table, in megabytes. */
  @JsonProperty("memory_estimate")
  double memoryEstimate;

  @JsonProperty("duplicate_rows")
  long duplicateRows;

  @JsonProperty("quality_score")
  int qualityScore;

  @JsonProperty("quality_grade")
  String qualityGrade;
}
