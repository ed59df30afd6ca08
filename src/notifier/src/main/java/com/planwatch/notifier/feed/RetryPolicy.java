package com.planwatch.notifier.feed;

import java.time.Duration;

/**
 * Attempt ceiling and backoff delays for one feed fetch.
 *
 * <p>Rate-limited attempts back off exponentially ({@code base * 2^(attempt-1)}), transient
 * failures linearly ({@code base * attempt}). Attempts are numbered from 1.
 */
public record RetryPolicy(int maxAttempts, Duration baseDelay) {
  public static final int DEFAULT_MAX_ATTEMPTS = 3;
  public static final Duration DEFAULT_BASE_DELAY = Duration.ofSeconds(1);

  public RetryPolicy {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be >= 1: " + maxAttempts);
    }
    if (baseDelay == null || baseDelay.isNegative()) {
      throw new IllegalArgumentException("baseDelay must be >= 0");
    }
  }

  public static RetryPolicy defaults() {
    return new RetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_BASE_DELAY);
  }

  public Duration exponentialDelay(int attempt) {
    return baseDelay.multipliedBy(1L << Math.min(Math.max(0, attempt - 1), 20));
  }

  public Duration linearDelay(int attempt) {
    return baseDelay.multipliedBy(Math.max(1, attempt));
  }

  /** {@code true} once {@code attempt} has used up the ceiling. */
  public boolean exhausted(int attempt) {
    return attempt >= maxAttempts;
  }
}
