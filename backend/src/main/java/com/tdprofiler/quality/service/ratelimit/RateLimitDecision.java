package com.tdprofiler.quality.service.ratelimit;

import lombok.Value;

/**
 * Outcome of a rate-limit check. {@code remaining} is {@code -1} for actions without a limit;
 * {@code retryAfterSeconds} is only meaningful when the request was refused.
 */
@Value
public class RateLimitDecision {

  boolean allowed;
  int remaining;
  long retryAfterSeconds;

  public static RateLimitDecision unlimited() {
    return new RateLimitDecision(true, -1, 0);
  }

  public static RateLimitDecision allowed(int remaining) {
    return new RateLimitDecision(true, remaining, 0);
  }

  public static RateLimitDecision refused(long retryAfterSeconds) {
    return new RateLimitDecision(false, 0, retryAfterSeconds);
  }
}
