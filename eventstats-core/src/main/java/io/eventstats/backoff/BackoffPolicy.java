package io.eventstats.backoff;

import java.time.Duration;

/**
 * Strategy for computing how long to wait before the next attempt of a failing or idle operation.
 *
 * @see ExponentialBackoffPolicy
 */
public interface BackoffPolicy {

    /**
     * Computes the delay before the next attempt.
     *
     * @param attempt number of consecutive failed (or idle) attempts so far, 0-based;
     *                negative values are treated as 0
     * @return delay (non-negative)
     */
    Duration computeDelay(int attempt);
}
