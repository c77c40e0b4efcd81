package io.rollcron.utils;

import io.rollcron.core.RetryConfig;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Retry delay and startup jitter computations.
 */
public final class Backoff {

    /**
     * Upper bound of the exponential part of a retry delay (a larger base delay is still honored).
     */
    public static final Duration MAX_BACKOFF = Duration.ofHours(1);

    private static final int MAX_EXPONENT = 20; // avoid overflow

    private Backoff() {
    }

    /**
     * Delay before retry number {@code attemptIndex + 1}.
     * attemptIndex starts from 0 (delay before the first retry).
     * Default growth: delay, 2*delay, 4*delay... capped at {@link #MAX_BACKOFF}, plus
     * a uniform random component bounded by {@code retry.jitter} when configured.
     */
    public static Duration calculate(RetryConfig retry, int attemptIndex) {
        Objects.requireNonNull(retry, "retry must not be null");
        return exponential(retry.delay(), attemptIndex).plus(generateJitter(retry.jitter()));
    }

    /**
     * Deterministic part of {@link #calculate(RetryConfig, int)}.
     */
    public static Duration exponential(Duration delay, int attemptIndex) {
        if (attemptIndex < 0) {
            throw new IllegalArgumentException("attemptIndex must not be negative");
        }
        int exp = Math.min(attemptIndex, MAX_EXPONENT);
        long baseMs = delay.toMillis();
        long capMs = Math.max(baseMs, MAX_BACKOFF.toMillis());
        long ms = baseMs > (capMs >> exp) ? capMs : baseMs << exp;
        return Duration.ofMillis(Math.min(ms, capMs));
    }

    /**
     * Uniform random duration in [0, max]; zero for a null, zero or negative bound.
     */
    public static Duration generateJitter(Duration max) {
        if (max == null || max.isZero() || max.isNegative()) {
            return Duration.ZERO;
        }
        long maxMs = max.toMillis();
        if (maxMs == 0) {
            return Duration.ZERO;
        }
        return Duration.ofMillis(ThreadLocalRandom.current().nextLong(maxMs + 1));
    }
}
