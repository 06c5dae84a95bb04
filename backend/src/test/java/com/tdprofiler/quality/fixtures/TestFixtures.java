package com.tdprofiler.quality.fixtures;

import java.util.List;

import com.tdprofiler.quality.config.ProfilerProperties;
import com.tdprofiler.quality.dto.profile.ColumnProfile;
import com.tdprofiler.quality.dto.profile.ColumnStatistics;
import com.tdprofiler.quality.dto.profile.DatasetProfile;
import com.tdprofiler.quality.dto.profile.DatasetSummary;
import com.tdprofiler.quality.dto.profile.InferredType;
import com.tdprofiler.quality.dto.profile.IssueType;
import com.tdprofiler.quality.dto.profile.IssuesSummary;
import com.tdprofiler.quality.dto.profile.OutlierSummary;
import com.tdprofiler.quality.dto.profile.PatternSummary;
import com.tdprofiler.quality.dto.profile.QualityIssue;
import com.tdprofiler.quality.dto.profile.Severity;
import com.tdprofiler.quality.dto.profile.TopValue;
import com.tdprofiler.quality.model.CellValue;
import com.tdprofiler.quality.model.DataTable;
import com.tdprofiler.quality.model.TableColumn;
import com.tdprofiler.quality.service.profiling.CompletenessService;
import com.tdprofiler.quality.service.profiling.DateParsingService;
import com.tdprofiler.quality.service.profiling.OutlierDetectionService;
import com.tdprofiler.quality.service.profiling.PatternAnalysisService;
import com.tdprofiler.quality.service.profiling.ProfilingEngineService;
import com.tdprofiler.quality.service.profiling.StatisticsService;
import com.tdprofiler.quality.service.profiling.TypeInferenceService;
import com.tdprofiler.quality.service.scoring.QualityScoringService;
import com.tdprofiler.quality.service.semantic_type.SemanticTypeDetectionService;
import com.tdprofiler.quality.service.semantic_type.SemanticTypeRegistryService;

/** Shared tables, profiles and service wiring for unit tests. */
public final class TestFixtures {

  private TestFixtures() {}

  public static ProfilerProperties defaultProperties() {
    return new ProfilerProperties();
  }

  /** The profiling engine wired by hand, as Spring would wire it. */
  public static ProfilingEngineService profilingEngine() {
    return profilingEngine(defaultProperties());
  }

  public static ProfilingEngineService profilingEngine(ProfilerProperties properties) {
    return new ProfilingEngineService(
        new TypeInferenceService(properties, new DateParsingService(properties)),
        new CompletenessService(),
        new StatisticsService(properties),
        new OutlierDetectionService(properties),
        new PatternAnalysisService(properties),
        new SemanticTypeDetectionService(properties, new SemanticTypeRegistryService(properties)),
        new QualityScoringService(properties));
  }

  public static TableColumn column(String name, Object... values) {
    return DataTable.builder("t").column(name, values).build().getColumns().get(0);
  }

  public static TableColumn column(String name, List<CellValue> cells) {
    return new TableColumn(name, cells);
  }

  /** Five customers: unique ids, emails, one missing age and one outlying balance. */
  public static DataTable customersTable() {
    return DataTable.builder("customers")
        .column("id", 1, 2, 3, 4, 5)
        .column(
            "email",
            "ann@example.com",
            "bob@example.com",
            "cy@example.org",
            "dee@example.net",
            "eve@example.com")
        .column("age", 34, 28, null, 45, 39)
        .column("balance", 10.5, 12.0, 11.25, 9.75, 500.0)
        .column("active", true, false, true, true, false)
        .build();
  }

  public static DataTable messyTable() {
    return DataTable.builder("messy")
        .column("id", 1, 2, 3, 4, 5)
        .column("messy", 1, null, null, 4, 100)
        .build();
  }

  public static DatasetProfile sampleProfile() {
    ColumnProfile email =
        ColumnProfile.builder()
            .name("email")
            .inferredType(InferredType.STRING)
            .semanticType("email")
            .nullCount(1)
            .nullPercentage(25.0)
            .emptyStringCount(0)
            .distinctCount(3)
            .unique(false)
            .potentialPk(false)
            .stats(ColumnStatistics.builder().minLength(11).maxLength(15).meanLength(13.0).build())
            .outliers(OutlierSummary.notApplicable())
            .patterns(PatternSummary.empty())
            .topValues(
                List.of(TopValue.builder().value("a@b.com").count(1).percentage(25.0).build()))
            .qualityScore(75)
            .issues(
                List.of(
                    QualityIssue.builder()
                        .severity(Severity.CRITICAL)
                        .issue("25.0% null values detected")
                        .type(IssueType.COMPLETENESS)
                        .build(),
                    QualityIssue.builder()
                        .severity(Severity.INFO)
                        .issue("Multiple structural patterns detected (top pattern: 50.0%)")
                        .type(IssueType.CONSISTENCY)
                        .build()))
            .build();
    ColumnProfile amount =
        ColumnProfile.builder()
            .name("amount")
            .inferredType(InferredType.INTEGER)
            .nullCount(0)
            .nullPercentage(0.0)
            .distinctCount(4)
            .unique(true)
            .potentialPk(true)
            .stats(ColumnStatistics.empty())
            .outliers(OutlierSummary.notApplicable())
            .patterns(PatternSummary.empty())
            .topValues(List.of())
            .qualityScore(100)
            .issues(List.of())
            .build();

    List<ColumnProfile> columns = List.of(email, amount);
    return DatasetProfile.builder()
        .summary(
            DatasetSummary.builder()
                .rowCount(4)
                .columnCount(2)
                .memoryEstimate(0.0001)
                .duplicateRows(0)
                .qualityScore(87)
                .qualityGrade("B")
                .build())
        .columns(columns)
        .issuesSummary(IssuesSummary.tally(email.getIssues()))
        .build();
  }
}
