package com.tdprofiler.quality.config;

import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Per-action request limits, e.g. {@code app.rate-limit.limits.upload.max-requests=5}. */
@Data
@Component
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

  private boolean enabled = true;

  private Map<String, Limit> limits = new LinkedHashMap<>(Map.of("upload", new Limit(5, 60)));

  @Data
  @NoArgsConstructor
  @AllArgsConstructor
  public static class Limit {
    private int maxRequests;
    private long windowMinutes;
  }
}
