package org.maap.client.dps;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff bounded by a per-wait ceiling and a total time budget.
 *
 * <p>The wait after attempt {@code n} (zero based) is {@code min(base * 2^n, maxInterval)}.
 */
public record BackoffPolicy(Duration baseInterval, Duration maxInterval, Duration maxTotalTime) {
  public static final Duration DEFAULT_BASE = Duration.ofSeconds(1);
  public static final Duration DEFAULT_MAX_INTERVAL = Duration.ofSeconds(64);
  public static final Duration DEFAULT_MAX_TOTAL = Duration.ofSeconds(172_800);

  public BackoffPolicy {
    Objects.requireNonNull(baseInterval, "baseInterval");
    Objects.requireNonNull(maxInterval, "maxInterval");
    Objects.requireNonNull(maxTotalTime, "maxTotalTime");
    if (baseInterval.isNegative() || baseInterval.isZero()) {
      throw new IllegalArgumentException("baseInterval must be positive");
    }
    if (maxInterval.compareTo(baseInterval) < 0) {
      throw new IllegalArgumentException("maxInterval must be >= baseInterval");
    }
    if (maxTotalTime.isNegative()) {
      throw new IllegalArgumentException("maxTotalTime must not be negative");
    }
  }

  /** 1 s base, 64 s ceiling, 48 h budget. */
  public static BackoffPolicy defaults() {
    return new BackoffPolicy(DEFAULT_BASE, DEFAULT_MAX_INTERVAL, DEFAULT_MAX_TOTAL);
  }

  public Duration delayFor(int attempt) {
    if (attempt < 0) {
      throw new IllegalArgumentException("attempt must be >= 0");
    }
    long baseMillis = baseInterval.toMillis();
    long maxMillis = maxInterval.toMillis();
    // past 62 doublings the shift overflows; the ceiling applies long before that
    if (attempt >= 62 || baseMillis > (maxMillis >> attempt)) {
      return maxInterval;
    }
    return Duration.ofMillis(Math.min(baseMillis << attempt, maxMillis));
  }
}
