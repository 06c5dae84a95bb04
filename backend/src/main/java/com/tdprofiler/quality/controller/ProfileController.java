package com.tdprofiler.quality.controller;

import java.util.Map;

import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import com.tdprofiler.quality.dto.job.ProfilingJob;
import com.tdprofiler.quality.dto.profile.ColumnProfile;
import com.tdprofiler.quality.dto.profile.DatasetProfile;
import com.tdprofiler.quality.dto.profile.ProfileRequest;
import com.tdprofiler.quality.exception.ResourceNotFoundException;
import com.tdprofiler.quality.service.job.ProfilingJobService;
import com.tdprofiler.quality.service.profiling.ProfilingEngineService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "Profiling", description = "Profiling jobs and synchronous profiling")
public class ProfileController {

  private final ProfilingJobService jobService;
  private final ProfilingEngineService profilingEngineService;

  @GetMapping(value = "/profile/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Get a profiling job",
      description = "Status of an upload's profiling job, with the report once completed")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Job found",
            content = @Content(schema = @Schema(implementation = ProfilingJob.class))),
        @ApiResponse(responseCode = "404", description = "Job not found", content = @Content)
      })
  public ResponseEntity<ProfilingJob> getProfile(@PathVariable String jobId) {
    return ResponseEntity.ok(jobService.requireJob(jobId));
  }

  @GetMapping(
      value = "/profile/{jobId}/column/{columnName}",
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(summary = "Get one column's profile from a completed job")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Column found",
            content = @Content(schema = @Schema(implementation = ColumnProfile.class))),
        @ApiResponse(
            responseCode = "404",
            description = "Job not found, not completed, or no such column",
            content = @Content)
      })
  public ResponseEntity<ColumnProfile> getColumnProfile(
      @PathVariable String jobId, @PathVariable String columnName) {
    DatasetProfile profile = jobService.requireResult(jobId);
    return profile
        .findColumn(columnName)
        .map(ResponseEntity::ok)
        .orElseThrow(() -> new ResourceNotFoundException("Column not found: " + columnName));
  }

  @PostMapping(
      value = "/profile",
      consumes = MediaType.APPLICATION_JSON_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Profile an inline table",
      description = "Profiles the submitted rows synchronously and returns the report")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Profile computed",
            content = @Content(schema = @Schema(implementation = DatasetProfile.class))),
        @ApiResponse(responseCode = "400", description = "Invalid request", content = @Content)
      })
  public ResponseEntity<DatasetProfile> profileTable(@Valid @RequestBody ProfileRequest request) {
    log.info(
        "Received profiling request for table '{}' with {} columns and {} rows",
        request.getTableName(),
        request.getColumns().size(),
        request.getData().size());
    return ResponseEntity.ok(profilingEngineService.profile(request.toTable()));
  }

  @GetMapping("/health")
  @Operation(summary = "Health check", description = "Check if the profiling service is up")
  @ApiResponses(value = {@ApiResponse(responseCode = "200", description = "Service is healthy")})
  public ResponseEntity<Map<String, Object>> health() {
    return ResponseEntity.ok(Map.of("status", "UP", "timestamp", System.currentTimeMillis()));
  }
}
