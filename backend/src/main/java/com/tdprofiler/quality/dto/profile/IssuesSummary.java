package com.tdprofiler.quality.dto.profile;

import java.util.Collection;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class IssuesSummary {

  @JsonProperty("critical")
  int critical;

  @JsonProperty("warning")
  int warning;

  @JsonProperty("info")
  int info;

  public static IssuesSummary tally(Collection<QualityIssue> issues) {
    int critical = 0;
    int warning = 0;
    int info = 0;
    for (QualityIssue issue : issues) {
      switch (issue.getSeverity()) {
        case CRITICAL:
          critical++;
          break;
        case WARNING:
          warning++;
          break;
        default:
          info++;
      }
    }
    return IssuesSummary.builder().critical(critical).warning(warning).info(info).build();
  }

  public int total() {
    return critical + warning + info;
  }
}
