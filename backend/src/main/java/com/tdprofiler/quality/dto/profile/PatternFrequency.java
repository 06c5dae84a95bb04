package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class PatternFrequency {

  @JsonProperty("pattern")
  String pattern;

  @JsonProperty("percentage")
  double percentage;
}
