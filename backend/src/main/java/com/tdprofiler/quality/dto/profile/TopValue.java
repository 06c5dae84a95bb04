package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class TopValue {

  @JsonProperty("value")
  String value;

  @JsonProperty("count")
  long count;

  @JsonProperty("percentage")
  double percentage;
}
