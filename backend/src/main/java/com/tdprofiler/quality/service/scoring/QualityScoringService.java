package com.tdprofiler.quality.service.scoring;

import java.util.List;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.dto.profile.ColumnScore;
import com.tdprofiler.quality.dto.profile.DatasetScore;
import com.tdprofiler.quality.dto.profile.IssueType;
import com.tdprofiler.quality.dto.profile.OutlierSummary;
import com.tdprofiler.quality.dto.profile.PatternFrequency;
import com.tdprofiler.quality.dto.profile.PatternSummary;
import com.tdprofiler.quality.dto.profile.QualityIssue;
import com.tdprofiler.quality.dto.profile.Severity;
import com.tdprofiler.quality.service.profiling.Rounding;

import lombok.RequiredArgsConstructor;

/**
 * Penalty-based quality scores. A column starts at 100 and loses points for missing values,
 * outliers and inconsistent formatting, in that order; the dataset score averages the columns and
 * subtracts a duplicate-row penalty.
 */
@Service
@RequiredArgsConstructor
public class QualityScoringService {

  private final ProfilerProperties properties;

  public ColumnScore scoreColumn(
      double nullPercentage, OutlierSummary outliers, PatternSummary patterns, long totalRows) {
    ProfilerProperties.Scoring scoring = properties.getScoring();
    ColumnScore.ColumnScoreBuilder result = ColumnScore.builder();
    double score = 100;

    if (nullPercentage > 0) {
      score -= Math.min(nullPercentage, scoring.getMaxNullPenalty());
      result.issue(
          QualityIssue.builder()
              .severity(
                  nullPercentage > scoring.getCriticalNullPercentage()
                      ? Severity.CRITICAL
                      : Severity.WARNING)
              .issue(Rounding.format(nullPercentage, 1) + "% null values detected")
              .type(IssueType.COMPLETENESS)
              .build());
    }

    long outlierCount = outliers != null ? outliers.getCount() : 0;
    if (outlierCount > 0) {
      double outlierPercentage = (double) outlierCount / Math.max(totalRows, 1) * 100;
      score -=
          Math.min(
              outlierPercentage * scoring.getOutlierPenaltyWeight(),
              scoring.getMaxOutlierPenalty());
      result.issue(
          QualityIssue.builder()
              .severity(Severity.WARNING)
              .issue(outlierCount + " outliers detected")
              .type(IssueType.VALIDITY)
              .build());
    }

    List<PatternFrequency> top = patterns != null ? patterns.getPatternsOrEmpty() : List.of();
    if (top.size() > 1) {
      double topPercentage = top.get(0).getPercentage();
      if (topPercentage < scoring.getPatternConsistencyThreshold()) {
        score -= scoring.getPatternPenalty();
        result.issue(
            QualityIssue.builder()
                .severity(Severity.INFO)
                .issue(
                    "Multiple structural patterns detected (top pattern: " + topPercentage + "%)")
                .type(IssueType.CONSISTENCY)
                .build());
      }
    }

    return result.score(clamp(score)).build();
  }

  public DatasetScore scoreDataset(List<Integer> columnScores, long duplicateRows, long totalRows) {
    if (columnScores == null || columnScores.isEmpty()) {
      return new DatasetScore(0, "F");
    }
    ProfilerProperties.Scoring scoring = properties.getScoring();
    double average = columnScores.stream().mapToInt(Integer::intValue).average().orElse(0);

    double duplicatePenalty = 0;
    if (totalRows > 0) {
      double duplicatePercentage = (double) duplicateRows / totalRows * 100;
      duplicatePenalty =
          Math.min(
              duplicatePercentage * scoring.getDuplicatePenaltyWeight(),
              scoring.getMaxDuplicatePenalty());
    }

    int finalScore = clamp(average - duplicatePenalty);
    return new DatasetScore(finalScore, grade(finalScore));
  }

  public String grade(int score) {
    ProfilerProperties.Grades grades = properties.getGrades();
    if (score >= grades.getA()) {
      return "A";
    } else if (score >= grades.getB()) {
      return "B";
    } else if (score >= grades.getC()) {
      return "C";
    } else if (score >= grades.getD()) {
      return "D";
    }
    return "F";
  }

  private static int clamp(double score) {
    return (int) Math.max(0, Math.min(100, Math.floor(score)));
  }
}
