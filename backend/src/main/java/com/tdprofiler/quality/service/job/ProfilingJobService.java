package com.tdprofiler.quality.service.job;

import java.time.Clock;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.tdprofiler.quality.config.JobProperties;
import com.tdprofiler.quality.dto.job.JobStatus;
import com.tdprofiler.quality.dto.job.ProfilingJob;
import com.tdprofiler.quality.dto.profile.DatasetProfile;
import com.tdprofiler.quality.exception.ResourceNotFoundException;
import com.tdprofiler.quality.model.DataTable;
import com.tdprofiler.quality.service.data_processing.FileParsingService;
import com.tdprofiler.quality.service.profiling.ProfilingEngineService;

import lombok.extern.slf4j.Slf4j;

/**
 * In-memory store of upload jobs. Entries expire a fixed time after their last update and the
 * store holds a bounded number of jobs, evicting the least recently used first.
 */
@Slf4j
@Service
public class ProfilingJobService {

  private final Cache<String, ProfilingJob> jobs;
  private final FileParsingService fileParsingService;
  private final ProfilingEngineService profilingEngineService;
  private final Executor executor;
  private final Clock clock;

  @Autowired
  public ProfilingJobService(
      JobProperties properties,
      FileParsingService fileParsingService,
      ProfilingEngineService profilingEngineService,
      @Qualifier("taskExecutor") Executor executor,
      Clock clock) {
    this(
        properties,
        fileParsingService,
        profilingEngineService,
        executor,
        clock,
        Ticker.systemTicker());
  }

  ProfilingJobService(
      JobProperties properties,
      FileParsingService fileParsingService,
      ProfilingEngineService profilingEngineService,
      Executor executor,
      Clock clock,
      Ticker ticker) {
    this.jobs =
        CacheBuilder.newBuilder()
            .expireAfterWrite(properties.getTtlMinutes(), TimeUnit.MINUTES)
            .maximumSize(properties.getMaxJobs())
            .ticker(ticker)
            .build();
    this.fileParsingService = fileParsingService;
    this.profilingEngineService = profilingEngineService;
    this.executor = executor;
    this.clock = clock;
  }

  public String createJob(String fileName, long sizeBytes) {
    String jobId = UUID.randomUUID().toString();
    jobs.put(
        jobId,
        ProfilingJob.builder()
            .jobId(jobId)
            .status(JobStatus.PROCESSING)
            .filename(fileName)
            .fileSizeBytes(sizeBytes)
            .createdAt(clock.instant())
            .build());
    log.info("Created job {} for file '{}' ({} bytes)", jobId, fileName, sizeBytes);
    return jobId;
  }

  /** Parses and profiles the upload on the task executor, recording the outcome on the job. */
  public void submit(String jobId, byte[] content, String fileName) {
    executor.execute(() -> run(jobId, content, fileName));
  }

  void run(String jobId, byte[] content, String fileName) {
    try {
      DataTable table = fileParsingService.parse(content, fileName);
      DatasetProfile profile = profilingEngineService.profile(table);
      complete(jobId, profile);
    } catch (Exception e) {
      log.warn("Profiling failed for job {} ('{}')", jobId, fileName, e);
      fail(jobId, e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
    }
  }

  public void complete(String jobId, DatasetProfile profile) {
    boolean updated =
        update(
            jobId,
            job ->
                job.toBuilder()
                    .status(JobStatus.COMPLETED)
                    .result(profile)
                    .completedAt(clock.instant())
                    .build());
    if (updated) {
      log.info("Job {} completed", jobId);
    }
  }

  public void fail(String jobId, String reason) {
    boolean updated =
        update(
            jobId,
            job ->
                job.toBuilder()
                    .status(JobStatus.FAILED)
                    .error(reason)
                    .completedAt(clock.instant())
                    .build());
    if (updated) {
      log.info("Job {} failed: {}", jobId, reason);
    }
  }

  public Optional<ProfilingJob> getJob(String jobId) {
    return Optional.ofNullable(jobs.getIfPresent(jobId));
  }

  public ProfilingJob requireJob(String jobId) {
    return getJob(jobId).orElseThrow(() -> new ResourceNotFoundException("Job not found"));
  }

  /** The finished profile of a job; unknown, expired, failed and running jobs are not found. */
  public DatasetProfile requireResult(String jobId) {
    ProfilingJob job = requireJob(jobId);
    if (!job.isCompleted()) {
      throw new ResourceNotFoundException("Job not found or not completed");
    }
    return job.getResult();
  }

  public long size() {
    jobs.cleanUp();
    return jobs.size();
  }

  private boolean update(String jobId, UnaryOperator<ProfilingJob> change) {
    ProfilingJob updated = jobs.asMap().computeIfPresent(jobId, (id, job) -> change.apply(job));
    if (updated == null) {
      log.warn("Job {} no longer exists; dropping update", jobId);
      return false;
    }
    return true;
  }
}
