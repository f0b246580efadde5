package io.eventstats.backoff;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff policy using capped exponential growth.
 *
 * <p>Delay formula: {@code min(base * 2^attempt, max)}. With a 100ms base and a 5s cap,
 * attempts 0..3 wait 100, 200, 400 and 800ms. Without jitter the result is deterministic.
 * {@link #withJitter(boolean)} scales the delay by a random factor in [0.5, 1.5), still
 * capped at {@code max}.
 */
public final class ExponentialBackoffPolicy implements BackoffPolicy {
  private final long baseDelayMs;
  private final long maxDelayMs;
  private final boolean jitter;

  /**
   * @param baseDelay delay for attempt 0
   * @param maxDelay  maximum delay cap
   */
  public ExponentialBackoffPolicy(Duration baseDelay, Duration maxDelay) {
    this(toMillis(baseDelay, "baseDelay"), toMillis(maxDelay, "maxDelay"), false);
  }

  private ExponentialBackoffPolicy(long baseDelayMs, long maxDelayMs, boolean jitter) {
    if (baseDelayMs <= 0) {
      throw new IllegalArgumentException("baseDelay must be > 0, got: " + baseDelayMs + "ms");
    }
    if (maxDelayMs < baseDelayMs) {
      throw new IllegalArgumentException("maxDelay must be >= baseDelay, got: " + maxDelayMs + "ms");
    }
    this.baseDelayMs = baseDelayMs;
    this.maxDelayMs = maxDelayMs;
    this.jitter = jitter;
  }

  /**
   * Returns a copy of this policy with jitter turned on or off.
   */
  public ExponentialBackoffPolicy withJitter(boolean jitter) {
    return new ExponentialBackoffPolicy(baseDelayMs, maxDelayMs, jitter);
  }

  public Duration baseDelay() {
    return Duration.ofMillis(baseDelayMs);
  }

  public Duration maxDelay() {
    return Duration.ofMillis(maxDelayMs);
  }

  @Override
  public Duration computeDelay(int attempt) {
    int n = Math.max(0, attempt);
    long expDelay;
    if (n >= 62) {
      expDelay = Long.MAX_VALUE;
    } else {
      long shift = 1L << n;
      // Guard against overflow: if shift exceeds maxDelayMs/baseDelayMs, cap directly
      expDelay = shift > maxDelayMs / baseDelayMs ? Long.MAX_VALUE : baseDelayMs * shift;
    }
    long capped = Math.min(maxDelayMs, expDelay);
    if (!jitter) {
      return Duration.ofMillis(capped);
    }
    double factor = ThreadLocalRandom.current().nextDouble(0.5, 1.5);
    long withJitter = (long) (capped * factor);
    return Duration.ofMillis(Math.min(maxDelayMs, Math.max(0L, withJitter)));
  }

  private static long toMillis(Duration duration, String name) {
    Objects.requireNonNull(duration, name);
    return duration.toMillis();
  }
}
