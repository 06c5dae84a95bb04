package com.tdprofiler.quality.dto.profile;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Complete data-quality report for one table. Built once, never modified. */
@Value
@Builder
@Jacksonized
public class DatasetProfile {

  @JsonProperty("summary")
  DatasetSummary summary;

  @JsonProperty("columns")
  List<ColumnProfile> columns;

  @JsonProperty("issues_summary")
  IssuesSummary issuesSummary;

  public Optional<ColumnProfile> findColumn(String name) {
    return columns.stream().filter(c -> c.getName().equals(name)).findFirst();
  }
}
