package com.tdprofiler.quality.controller;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import org.springframework.http.ContentDisposition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.tdprofiler.quality.dto.profile.DatasetProfile;
import com.tdprofiler.quality.service.job.ProfilingJobService;
import com.tdprofiler.quality.service.report.ReportExportService;
import com.tdprofiler.quality.service.report.ReportFormat;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Reports", description = "Download profiling reports")
public class ReportController {

  private final ProfilingJobService jobService;
  private final ReportExportService reportExportService;

  @GetMapping("/report/{jobId}")
  @Operation(
      summary = "Download a report",
      description = "Exports a completed job's profile as JSON, CSV or HTML")
  @ApiResponses(
      value = {
        @ApiResponse(responseCode = "200", description = "Report exported"),
        @ApiResponse(responseCode = "400", description = "Unsupported format"),
        @ApiResponse(responseCode = "404", description = "Job not found or not completed")
      })
  public ResponseEntity<byte[]> getReport(
      @PathVariable String jobId,
      @Parameter(description = "json, csv or html") @RequestParam(defaultValue = "json")
          String format)
      throws IOException {
    ReportFormat reportFormat = ReportFormat.fromString(format);
    DatasetProfile profile = jobService.requireResult(jobId);

    String report = reportExportService.export(profile, reportFormat);
    byte[] body = report.getBytes(StandardCharsets.UTF_8);
    log.info("Exported report for job {} as {} ({} bytes)", jobId, reportFormat, body.length);

    return ResponseEntity.ok()
        .contentType(MediaType.parseMediaType(reportFormat.getContentType() + ";charset=UTF-8"))
        .header(
            HttpHeaders.CONTENT_DISPOSITION,
            ContentDisposition.attachment()
                .filename("profile_" + jobId + "." + reportFormat.getExtension())
                .build()
                .toString())
        .body(body);
  }
}
