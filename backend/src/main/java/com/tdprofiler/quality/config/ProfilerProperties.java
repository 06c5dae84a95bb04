package com.tdprofiler.quality.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

/** Tunables of the profiling engine: sample sizes, thresholds, scoring penalties and grades. */
@Data
@Component
@ConfigurationProperties(prefix = "profiler")
public class ProfilerProperties {

  private String dateLocale = "en-US";
  private int topValues = 10;
  private int topPatterns = 5;
  private double semanticMatchThreshold = 0.5;
  private double iqrMultiplier = 1.5;

  private Sampling sampling = new Sampling();
  private Scoring scoring = new Scoring();
  private Grades grades = new Grades();
  private List<CustomSemanticType> customSemanticTypes = new ArrayList<>();

  @Data
  public static class Sampling {
    private int typeInference = 100;
    private int semanticType = 100;
    private int patterns = 500;
  }

  @Data
  public static class Scoring {
    private double maxNullPenalty = 40;
    private double criticalNullPercentage = 20;
    private double outlierPenaltyWeight = 2;
    private double maxOutlierPenalty = 20;
    private double patternConsistencyThreshold = 80;
    private double patternPenalty = 10;
    private double duplicatePenaltyWeight = 2;
    private double maxDuplicatePenalty = 10;
  }

  @Data
  public static class Grades {
    private int a = 90;
    private int b = 80;
    private int c = 70;
    private int d = 60;
  }

  /** Extra rule appended after the built-in semantic types. */
  @Data
  public static class CustomSemanticType {
    private String name;
    private String pattern;
  }
}
