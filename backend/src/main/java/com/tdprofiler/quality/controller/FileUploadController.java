package com.tdprofiler.quality.controller;

import java.io.IOException;
import java.util.Locale;
import java.util.Set;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import com.tdprofiler.quality.dto.job.JobStatus;
import com.tdprofiler.quality.dto.job.UploadResponse;
import com.tdprofiler.quality.exception.ErrorResponse;
import com.tdprofiler.quality.service.job.ProfilingJobService;
import com.tdprofiler.quality.service.ratelimit.ClientIpResolver;
import com.tdprofiler.quality.service.ratelimit.RateLimiterService;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

@Slf4j
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Tag(name = "File Upload", description = "Upload a file and start profiling it")
public class FileUploadController {

  static final String UPLOAD_ACTION = "upload";
  public static final String RATE_LIMIT_REMAINING_HEADER = "X-RateLimit-Remaining";

  private static final int BASE_ESTIMATE_SECONDS = 5;
  private static final long BYTES_PER_EXTRA_SECOND = 1024L * 1024L;

  @Value("${app.upload.max-file-size:52428800}")
  private long maxFileSize;

  @Value("${app.upload.allowed-extensions:csv,json,xlsx,xls}")
  private Set<String> allowedExtensions;

  private final ProfilingJobService jobService;
  private final RateLimiterService rateLimiterService;

  @PostMapping(
      value = "/upload",
      consumes = MediaType.MULTIPART_FORM_DATA_VALUE,
      produces = MediaType.APPLICATION_JSON_VALUE)
  @Operation(
      summary = "Upload a file for profiling",
      description =
          "Accepts a CSV, JSON or Excel file and profiles it in the background. Poll the"
              + " returned progress URL for the result.")
  @ApiResponses(
      value = {
        @ApiResponse(
            responseCode = "200",
            description = "Profiling job started",
            content = @Content(schema = @Schema(implementation = UploadResponse.class))),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid file",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(
            responseCode = "413",
            description = "File too large",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class))),
        @ApiResponse(
            responseCode = "429",
            description = "Too many uploads from this address",
            content = @Content(schema = @Schema(implementation = ErrorResponse.class)))
      })
  public ResponseEntity<UploadResponse> uploadFile(
      @Parameter(description = "File to profile (csv, json, xlsx, xls)", required = true)
          @RequestParam("file")
          MultipartFile file,
      HttpServletRequest request)
      throws IOException {
    validateFile(file);

    String clientIp = ClientIpResolver.resolve(request);
    int remaining = rateLimiterService.acquireOrThrow(clientIp, UPLOAD_ACTION);

    String fileName = file.getOriginalFilename();
    byte[] content = file.getBytes();
    String jobId = jobService.createJob(fileName, content.length);
    jobService.submit(jobId, content, fileName);

    UploadResponse response =
        UploadResponse.builder()
            .jobId(jobId)
            .status(JobStatus.PROCESSING)
            .filename(fileName)
            .fileSizeBytes(content.length)
            .estimatedTimeSec(estimateSeconds(content.length))
            .progressUrl("/api/profile/" + jobId)
            .build();

    return ResponseEntity.ok()
        .header(RATE_LIMIT_REMAINING_HEADER, String.valueOf(remaining))
        .body(response);
  }

  static int estimateSeconds(long sizeBytes) {
    return BASE_ESTIMATE_SECONDS + (int) (sizeBytes / BYTES_PER_EXTRA_SECOND);
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = extractFileExtension(fileName);
    if (!allowedExtensions.contains(extension.toLowerCase(Locale.ROOT))) {
      throw new IllegalArgumentException(
          "File type not supported. Allowed types: " + allowedExtensions);
    }
  }

  private String extractFileExtension(String fileName) {
    int lastDotIndex = fileName.lastIndexOf('.');
    return (lastDotIndex == -1 || lastDotIndex == fileName.length() - 1)
        ? ""
        : fileName.substring(lastDotIndex + 1);
  }
}
