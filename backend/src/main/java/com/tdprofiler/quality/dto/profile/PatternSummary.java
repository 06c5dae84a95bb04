package com.tdprofiler.quality.dto.profile;

import java.util.Collections;
import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Most frequent structural masks; serializes as {@code {}} when nothing was analysed. */
@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatternSummary {

  private static final PatternSummary EMPTY = PatternSummary.builder().build();

  @JsonProperty("top_patterns")
  List<PatternFrequency> topPatterns;

  public static PatternSummary empty() {
    return EMPTY;
  }

  @JsonIgnore
  public List<PatternFrequency> getPatternsOrEmpty() {
    return topPatterns == null ? Collections.emptyList() : topPatterns;
  }
}
