package com.tdprofiler.quality.dto.job;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tdprofiler.quality.dto.profile.DatasetProfile;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/** Snapshot of one upload's profiling job. A state change produces a new snapshot. */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class ProfilingJob {

  @JsonProperty("job_id")
  String jobId;

  @JsonProperty("status")
  JobStatus status;

  @JsonProperty("filename")
  String filename;

  @JsonProperty("file_size_bytes")
  long fileSizeBytes;

  @JsonProperty("created_at")
  Instant createdAt;

  @JsonProperty("completed_at")
  Instant completedAt;

  @JsonProperty("error")
  String error;

  @JsonProperty("result")
  DatasetProfile result;

  @JsonIgnore
  public boolean isCompleted() {
    return status == JobStatus.COMPLETED && result != null;
  }
}
