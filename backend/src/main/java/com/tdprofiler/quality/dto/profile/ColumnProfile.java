package com.tdprofiler.quality.dto.profile;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class ColumnProfile {

  @JsonProperty("name")
  String name;

  @JsonProperty("inferred_type")
  InferredType inferredType;

  @JsonProperty("semantic_type")
  String semanticType;

  @JsonProperty("null_count")
  long nullCount;

  @JsonProperty("null_percentage")
  double nullPercentage;

  @JsonProperty("empty_string_count")
  long emptyStringCount;

  @JsonProperty("distinct_count")
  long distinctCount;

  @JsonProperty("is_unique")
  boolean unique;

  @JsonProperty("is_potential_pk")
  boolean potentialPk;

  @JsonProperty("stats")
  ColumnStatistics stats;

  @JsonProperty("outliers")
  OutlierSummary outliers;

  @JsonProperty("patterns")
  PatternSummary patterns;

  @JsonProperty("top_values")
  List<TopValue> topValues;

  @JsonProperty("quality_score")
  int qualityScore;

  @JsonProperty("issues")
  List<QualityIssue> issues;
}
