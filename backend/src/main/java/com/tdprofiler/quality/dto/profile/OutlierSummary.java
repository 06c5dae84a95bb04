package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** IQR outlier result. Bounds are absent when the column was not eligible for detection. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class OutlierSummary {

  public static final String NOT_APPLICABLE = "N/A";

  @JsonProperty("count")
  long count;

  @JsonProperty("lower_bound")
  Double lowerBound;

  @JsonProperty("upper_bound")
  Double upperBound;

  @JsonProperty("threshold")
  String threshold;

  public static OutlierSummary notApplicable() {
    return OutlierSummary.builder().count(0).threshold(NOT_APPLICABLE).build();
  }
}
