package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class CompletenessResult {

  @JsonProperty("null_count")
  long nullCount;

  @JsonProperty("null_percentage")
  double nullPercentage;

  @JsonProperty("empty_string_count")
  long emptyStringCount;
}
