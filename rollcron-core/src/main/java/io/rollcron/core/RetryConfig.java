package io.rollcron.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Retry policy of a job.
 *
 * @param max    number of retries after the first attempt (total attempts = max + 1)
 * @param delay  base delay before the first retry
 * @param jitter optional upper bound of random delay added to every retry; null for none
 */
public record RetryConfig(int max, Duration delay, Duration jitter) {

    public RetryConfig {
        if (max < 0) {
            throw new IllegalArgumentException("retry.max must not be negative");
        }
        Objects.requireNonNull(delay, "retry.delay must not be null");
        if (delay.isNegative()) {
            throw new IllegalArgumentException("retry.delay must not be negative");
        }
        if (jitter != null && jitter.isNegative()) {
            throw new IllegalArgumentException("retry.jitter must not be negative");
        }
    }

    public RetryConfig(int max, Duration delay) {
        this(max, delay, null);
    }
}
