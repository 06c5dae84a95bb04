package com.tdprofiler.quality.service.profiling;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.tdprofiler.quality.dto.profile.ColumnProfile;
import com.tdprofiler.quality.dto.profile.ColumnScore;
import com.tdprofiler.quality.dto.profile.ColumnStatistics;
import com.tdprofiler.quality.dto.profile.CompletenessResult;
import com.tdprofiler.quality.dto.profile.DatasetProfile;
import com.tdprofiler.quality.dto.profile.DatasetScore;
import com.tdprofiler.quality.dto.profile.DatasetSummary;
import com.tdprofiler.quality.dto.profile.InferredType;
import com.tdprofiler.quality.dto.profile.IssuesSummary;
import com.tdprofiler.quality.dto.profile.OutlierSummary;
import com.tdprofiler.quality.dto.profile.PatternSummary;
import com.tdprofiler.quality.dto.profile.QualityIssue;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.DataTable;
import com.tdprofiler.quality.model.TableColumn;
import com.tdprofiler.quality.service.scoring.QualityScoringService;
import com.tdprofiler.quality.service.semantic_type.SemanticTypeDetectionService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs every column analysis over a table and assembles the dataset report. Stateless: each call
 * works only on the table it is given.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ProfilingEngineService {

  private static final double BYTES_PER_MB = 1024.0 * 1024.0;
  private static final int POINTER_BYTES = 8;
  private static final int STRING_OVERHEAD_BYTES = 49;

  private final TypeInferenceService typeInferenceService;
  private final CompletenessService completenessService;
  private final StatisticsService statisticsService;
  private final OutlierDetectionService outlierDetectionService;
  private final PatternAnalysisService patternAnalysisService;
  private final SemanticTypeDetectionService semanticTypeDetectionService;
  private final QualityScoringService scoringService;

  public DatasetProfile profile(DataTable table) {
    long startTime = System.currentTimeMillis();
    int rowCount = table.getRowCount();
    long duplicateRows = countDuplicateRows(table);

    log.info(
        "Profiling table '{}' with {} rows and {} columns",
        table.getName(),
        rowCount,
        table.getColumnCount());

    List<ColumnProfile> columns = new ArrayList<>(table.getColumnCount());
    List<Integer> columnScores = new ArrayList<>(table.getColumnCount());
    List<QualityIssue> allIssues = new ArrayList<>();

    for (TableColumn column : table.getColumns()) {
      ColumnProfile profile = profileColumn(column, rowCount);
      columns.add(profile);
      columnScores.add(profile.getQualityScore());
      allIssues.addAll(profile.getIssues());
    }

    DatasetScore datasetScore = scoringService.scoreDataset(columnScores, duplicateRows, rowCount);

    DatasetSummary summary =
        DatasetSummary.builder()
            .rowCount(rowCount)
            .columnCount(table.getColumnCount())
            .memoryEstimate(estimateMemoryMb(table))
            .duplicateRows(duplicateRows)
            .qualityScore(datasetScore.getScore())
            .qualityGrade(datasetScore.getGrade())
            .build();

    log.info(
        "Profiled table '{}' in {} ms: score {} ({}), {} issues",
        table.getName(),
        System.currentTimeMillis() - startTime,
        datasetScore.getScore(),
        datasetScore.getGrade(),
        allIssues.size());

    return DatasetProfile.builder()
        .summary(summary)
        .columns(List.copyOf(columns))
        .issuesSummary(IssuesSummary.tally(allIssues))
        .build();
  }

  ColumnProfile profileColumn(TableColumn column, int rowCount) {
    InferredType inferredType = typeInferenceService.inferType(column);
    CompletenessResult completeness = completenessService.analyze(column);
    ColumnStatistics stats = statisticsService.calculateStats(column, inferredType);
    OutlierSummary outliers = outlierDetectionService.detectOutliers(column);
    PatternSummary patterns = patternAnalysisService.analyzePatterns(column);
    String semanticType = semanticTypeDetectionService.detect(column).orElse(null);

    ColumnScore score =
        scoringService.scoreColumn(
            completeness.getNullPercentage(), outliers, patterns, rowCount);

    long distinctCount = countDistinct(column);
    boolean unique = rowCount > 0 && distinctCount == rowCount;

    log.debug(
        "Column '{}': type={}, semantic={}, nulls={}, score={}",
        column.getName(),
        inferredType.getLabel(),
        semanticType,
        completeness.getNullCount(),
        score.getScore());

    return ColumnProfile.builder()
        .name(column.getName())
        .inferredType(inferredType)
        .semanticType(semanticType)
        .nullCount(completeness.getNullCount())
        .nullPercentage(completeness.getNullPercentage())
        .emptyStringCount(completeness.getEmptyStringCount())
        .distinctCount(distinctCount)
        .unique(unique)
        .potentialPk(unique && completeness.getNullCount() == 0)
        .stats(stats)
        .outliers(outliers)
        .patterns(patterns)
        .topValues(List.copyOf(statisticsService.getTopValues(column)))
        .qualityScore(score.getScore())
        .issues(List.copyOf(score.getIssues()))
        .build();
  }

  /** Rows equal, cell by cell, to an earlier row. */
  static long countDuplicateRows(DataTable table) {
    if (table.isEmpty()) {
      return 0;
    }
    Set<List<CellValue>> seen = new HashSet<>();
    long duplicates = 0;
    for (int row = 0; row < table.getRowCount(); row++) {
      if (!seen.add(table.row(row))) {
        duplicates++;
      }
    }
    return duplicates;
  }

  static long countDistinct(TableColumn column) {
    return new HashSet<>(column.nonMissing()).size();
  }

  static double estimateMemoryMb(DataTable table) {
    long bytes = 0;
    for (TableColumn column : table.getColumns()) {
      switch (column.getStorageType()) {
        case BOOLEAN:
          bytes += column.size();
          break;
        case TEXT:
          bytes += (long) POINTER_BYTES * column.size();
          for (CellValue cell : column.nonMissing()) {
            String text = cell.asText();
            bytes += STRING_OVERHEAD_BYTES + text.codePointCount(0, text.length());
          }
          break;
        default:
          bytes += (long) POINTER_BYTES * column.size();
      }
    }
    return bytes / BYTES_PER_MB;
  }
}
