package com.tdprofiler.quality.dto.job;

import com.fasterxml.jackson.annotation.JsonProperty;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
public class UploadResponse {

  @JsonProperty("job_id")
  String jobId;

  @JsonProperty("status")
  JobStatus status;

  @JsonProperty("filename")
  String filename;

  @JsonProperty("file_size_bytes")
  long fileSizeBytes;

  @JsonProperty("estimated_time_sec")
  int estimatedTimeSec;

  @JsonProperty("progress_url")
  String progressUrl;
}
