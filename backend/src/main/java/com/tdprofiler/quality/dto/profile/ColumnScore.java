package com.tdprofiler.quality.dto.profile;

import java.util.List;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

@Value
@Builder
public class ColumnScore {
  int score;
  @Singular List<QualityIssue> issues;
}
