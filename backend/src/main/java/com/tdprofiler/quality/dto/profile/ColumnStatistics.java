package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Type-conditional summary statistics. Numeric columns fill the value fields, string columns the
 * length fields; every other case serializes as an empty object.
 */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ColumnStatistics {

  private static final ColumnStatistics EMPTY = ColumnStatistics.builder().build();

  @JsonProperty("min")
  Double min;

  @JsonProperty("max")
  Double max;

  @JsonProperty("mean")
  Double mean;

  @JsonProperty("median")
  Double median;

  @JsonProperty("std")
  Double std;

  @JsonProperty("min_length")
  Integer minLength;

  @JsonProperty("max_length")
  Integer maxLength;

  @JsonProperty("mean_length")
  Double meanLength;

  public static ColumnStatistics empty() {
    return EMPTY;
  }

  @JsonIgnore
  public boolean isEmpty() {
    return min == null && minLength == null;
  }
}
