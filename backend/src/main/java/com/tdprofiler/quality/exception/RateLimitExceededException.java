package com.tdprofiler.quality.exception;

import lombok.Getter;

/** Raised when a client has used up its allowance for an action. */
@Getter
public class RateLimitExceededException extends RuntimeException {

  private final String action;
  private final long retryAfterSeconds;

  public RateLimitExceededException(String action, long retryAfterSeconds) {
    super(
        String.format(
            "Too many %s requests. Please try again in %d minutes.",
            action,
            retryAfterSeconds / 60));
    this.action = action;
    this.retryAfterSeconds = retryAfterSeconds;
  }
}
