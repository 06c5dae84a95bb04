package com.tdprofiler.quality.dto.profile;

import lombok.Value;

@Value
public class DatasetScore {
  int score;
  String grade;
}
