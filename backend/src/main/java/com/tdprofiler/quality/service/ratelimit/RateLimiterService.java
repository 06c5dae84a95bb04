package com.tdprofiler.quality.service.ratelimit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.tdprofiler.quality.config.RateLimitProperties;
import com.tdprofiler.quality.exception.RateLimitExceededException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Sliding-window request limiter keyed by client address and action. The check and the recording
 * of an accepted request happen under one lock, so concurrent callers cannot overshoot a limit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RateLimiterService {

  private final RateLimitProperties properties;
  private final Clock clock;

  private final Map<String, Deque<Instant>> requests = new HashMap<>();
  private final ReentrantLock lock = new ReentrantLock();

  public RateLimitDecision tryAcquire(String clientIp, String action) {
    RateLimitProperties.Limit limit = properties.getLimits().get(action);
    if (!properties.isEnabled() || limit == null) {
      return RateLimitDecision.unlimited();
    }

    Duration window = Duration.ofMinutes(limit.getWindowMinutes());
    String key = clientIp + "|" + action;

    lock.lock();
    try {
      Instant now = clock.instant();
      Deque<Instant> timestamps = requests.computeIfAbsent(key, k -> new ArrayDeque<>());
      Instant cutoff = now.minus(window);
      while (!timestamps.isEmpty() && !timestamps.peekFirst().isAfter(cutoff)) {
        timestamps.pollFirst();
      }

      if (timestamps.size() >= limit.getMaxRequests()) {
        Instant resetAt = timestamps.peekFirst().plus(window);
        long retryAfter = Math.max(0, Duration.between(now, resetAt).getSeconds());
        log.info("Refused '{}' for {}: retry in {}s", action, clientIp, retryAfter);
        return RateLimitDecision.refused(retryAfter);
      }

      timestamps.addLast(now);
      return RateLimitDecision.allowed(limit.getMaxRequests() - timestamps.size());
    } finally {
      lock.unlock();
    }
  }

  /** Records the request and returns the remaining allowance, or throws when refused. */
  public int acquireOrThrow(String clientIp, String action) {
    RateLimitDecision decision = tryAcquire(clientIp, action);
    if (!decision.isAllowed()) {
      throw new RateLimitExceededException(action, decision.getRetryAfterSeconds());
    }
    return decision.getRemaining();
  }

  /** Drops tracking entries whose windows have fully elapsed. */
  @Scheduled(fixedDelayString = "${app.rate-limit.purge-interval-ms:600000}")
  public void purgeExpired() {
    lock.lock();
    try {
      Instant now = clock.instant();
      requests
          .entrySet()
          .removeIf(
              entry -> {
                String action = entry.getKey().substring(entry.getKey().lastIndexOf('|') + 1);
                RateLimitProperties.Limit limit = properties.getLimits().get(action);
                Instant last = entry.getValue().peekLast();
                return limit == null
                    || last == null
                    || !last.plus(Duration.ofMinutes(limit.getWindowMinutes())).isAfter(now);
              });
    } finally {
      lock.unlock();
    }
  }

  int trackedKeys() {
    lock.lock();
    try {
      return requests.size();
    } finally {
      lock.unlock();
    }
  }
}
