package com.tdprofiler.quality.dto.profile;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class QualityIssue {

  @JsonProperty("severity")
  Severity severity;

  @JsonProperty("issue")
  String issue;

  @JsonProperty("type")
  IssueType type;
}
