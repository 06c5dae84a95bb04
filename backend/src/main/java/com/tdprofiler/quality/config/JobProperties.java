package com.tdprofiler.quality.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.Data;

@Data
@Component
@ConfigurationProperties(prefix = "app.jobs")
public class JobProperties {

  /** Minutes a job stays retrievable after its last update. */
  private long ttlMinutes = 60;

  private long maxJobs = 1000;
}
