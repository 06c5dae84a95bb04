package com.tdprofiler.quality.service.scoring;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.dto.profile.ColumnScore;
import com.tdprofiler.quality.dto.profile.DatasetScore;
import com.tdprofiler.quality.dto.profile.IssueType;
import com.tdprofiler.quality.dto.profile.OutlierSummary;
import com.tdprofiler.quality.dto.profile.PatternFrequency;
import com.tdprofiler.quality.dto.profile.PatternSummary;
import com.tdprofiler.quality.dto.profile.QualityIssue;
import com.tdprofiler.quality.dto.profile.Severity;

@DisplayName("QualityScoringService Tests")
class QualityScoringServiceTest {

  private final QualityScoringService service = new QualityScoringService(new ProfilerProperties());

  private static OutlierSummary outliers(long count) {
    return OutlierSummary.builder()
        .count(count)
        .lowerBound(0.0)
        .upperBound(1.0)
        .threshold("IQR * 1.5")
        .build();
  }

  private static PatternSummary patterns(double... percentages) {
    List<PatternFrequency> top = new ArrayList<>();
    for (int i = 0; i < percentages.length; i++) {
      top.add(PatternFrequency.builder().pattern("p" + i).percentage(percentages[i]).build());
    }
    return PatternSummary.builder().topPatterns(top).build();
  }

  @Nested
  @DisplayName("Column score")
  class ColumnScoring {

    @Test
    void shouldScoreCleanColumnAtHundred() {
      ColumnScore score =
          service.scoreColumn(0, OutlierSummary.notApplicable(), PatternSummary.empty(), 10);

      assertThat(score.getScore()).isEqualTo(100);
      assertThat(score.getIssues()).isEmpty();
    }

    @Test
    void shouldRaiseCriticalIssueAboveTwentyPercentNulls() {
      ColumnScore score = service.scoreColumn(25, null, null, 4);

      assertThat(score.getScore()).isEqualTo(75);
      QualityIssue issue = score.getIssues().get(0);
      assertThat(issue.getSeverity()).isEqualTo(Severity.CRITICAL);
      assertThat(issue.getType()).isEqualTo(IssueType.COMPLETENESS);
      assertThat(issue.getIssue()).isEqualTo("25.0% null values detected");
    }

    @Test
    void shouldRaiseWarningAtTwentyPercentNulls() {
      ColumnScore score = service.scoreColumn(20, null, null, 5);

      assertThat(score.getScore()).isEqualTo(80);
      assertThat(score.getIssues().get(0).getSeverity()).isEqualTo(Severity.WARNING);
    }

    @Test
    void shouldCapNullPenaltyAtForty() {
      assertThat(service.scoreColumn(90, null, null, 10).getScore()).isEqualTo(60);
    }

    @Test
    void shouldRoundNullPercentageInMessageAndFloorScore() {
      ColumnScore score = service.scoreColumn(100.0 / 3, null, null, 3);

      assertThat(score.getScore()).isEqualTo(66);
      assertThat(score.getIssues().get(0).getIssue()).isEqualTo("33.3% null values detected");
    }

    @Test
    void shouldPenaliseOutliersByShareOfRows() {
      ColumnScore score = service.scoreColumn(0, outliers(1), null, 100);

      assertThat(score.getScore()).isEqualTo(98);
      assertThat(score.getIssues()).singleElement().satisfies(issue -> {
        assertThat(issue.getSeverity()).isEqualTo(Severity.WARNING);
        assertThat(issue.getType()).isEqualTo(IssueType.VALIDITY);
        assertThat(issue.getIssue()).isEqualTo("1 outliers detected");
      });
    }

    @Test
    void shouldCapOutlierPenaltyAtTwenty() {
      assertThat(service.scoreColumn(0, outliers(1), null, 6).getScore()).isEqualTo(80);
    }

    @Test
    void shouldPenaliseInconsistentPatterns() {
      ColumnScore score = service.scoreColumn(0, null, patterns(66.67, 33.33), 3);

      assertThat(score.getScore()).isEqualTo(90);
      assertThat(score.getIssues().get(0).getSeverity()).isEqualTo(Severity.INFO);
      assertThat(score.getIssues().get(0).getIssue())
          .isEqualTo("Multiple structural patterns detected (top pattern: 66.67%)");
    }

    @Test
    void shouldAcceptDominantPattern() {
      assertThat(service.scoreColumn(0, null, patterns(80.0, 20.0), 5).getScore()).isEqualTo(100);
      assertThat(service.scoreColumn(0, null, patterns(40.0), 5).getScore()).isEqualTo(100);
    }

    @Test
    void shouldApplyPenaltiesInOrderAndNeverGoBelowZero() {
      ColumnScore score = service.scoreColumn(30, outliers(1), patterns(50.0, 50.0), 10);

      assertThat(score.getScore()).isEqualTo(40);
      assertThat(score.getIssues())
          .extracting(QualityIssue::getType)
          .containsExactly(IssueType.COMPLETENESS, IssueType.VALIDITY, IssueType.CONSISTENCY);

      ProfilerProperties harsh = new ProfilerProperties();
      harsh.getScoring().setMaxNullPenalty(100);
      assertThat(
              new QualityScoringService(harsh)
                  .scoreColumn(100, outliers(5), patterns(10.0, 10.0), 5)
                  .getScore())
          .isZero();
    }
  }

  @Nested
  @DisplayName("Dataset score")
  class DatasetScoring {

    @Test
    void shouldAverageColumnScores() {
      DatasetScore score = service.scoreDataset(List.of(90, 80), 0, 10);

      assertThat(score.getScore()).isEqualTo(85);
      assertThat(score.getGrade()).isEqualTo("B");
    }

    @Test
    void shouldCapDuplicatePenaltyAtTen() {
      assertThat(service.scoreDataset(List.of(100, 100), 5, 10).getScore()).isEqualTo(90);
    }

    @Test
    void shouldScoreEmptyDatasetAsZeroF() {
      DatasetScore score = service.scoreDataset(List.of(), 0, 0);

      assertThat(score.getScore()).isZero();
      assertThat(score.getGrade()).isEqualTo("F");
    }

    @Test
    void shouldIgnoreDuplicatesWithoutRows() {
      assertThat(service.scoreDataset(List.of(100), 0, 0).getScore()).isEqualTo(100);
    }

    @Test
    void shouldNeverIncreaseWithMoreDuplicates() {
      int previous = Integer.MAX_VALUE;
      for (int duplicates = 0; duplicates <= 20; duplicates++) {
        int score = service.scoreDataset(List.of(97, 95), duplicates, 20).getScore();
        assertThat(score).isLessThanOrEqualTo(previous);
        previous = score;
      }
    }
  }

  @ParameterizedTest
  @CsvSource({"100,A", "90,A", "89,B", "80,B", "79,C", "70,C", "69,D", "60,D", "59,F", "0,F"})
  void shouldMapScoresToGrades(int score, String grade) {
    assertThat(service.grade(score)).isEqualTo(grade);
  }
}
