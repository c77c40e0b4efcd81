package io.rollcron.utils;

import io.rollcron.core.RetryConfig;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class BackoffTest {

    @Test
    void calculateShouldGrowExponentially() {
        RetryConfig retry = new RetryConfig(5, Duration.ofMillis(10));

        assertThat(Backoff.calculate(retry, 0)).isEqualTo(Duration.ofMillis(10));
        assertThat(Backoff.calculate(retry, 1)).isEqualTo(Duration.ofMillis(20));
        assertThat(Backoff.calculate(retry, 2)).isEqualTo(Duration.ofMillis(40));
    }

    @Test
    void calculateShouldBeNonDecreasing() {
        RetryConfig retry = new RetryConfig(64, Duration.ofSeconds(3));
        Duration previous = Duration.ZERO;
        for (int attempt = 0; attempt < 64; attempt++) {
            Duration current = Backoff.calculate(retry, attempt);
            assertThat(current).isGreaterThanOrEqualTo(previous);
            previous = current;
        }
    }

    @Test
    void calculateShouldBeCapped() {
        RetryConfig retry = new RetryConfig(100, Duration.ofSeconds(1));
        assertThat(Backoff.calculate(retry, 40)).isEqualTo(Backoff.MAX_BACKOFF);
    }

    @Test
    void calculateShouldKeepBaseDelayAboveCap() {
        RetryConfig retry = new RetryConfig(3, Duration.ofHours(2));
        assertThat(Backoff.calculate(retry, 0)).isEqualTo(Duration.ofHours(2));
        assertThat(Backoff.calculate(retry, 3)).isEqualTo(Duration.ofHours(2));
    }

    @RepeatedTest(20)
    void calculateShouldAddBoundedJitter() {
        RetryConfig retry = new RetryConfig(3, Duration.ofMillis(100), Duration.ofMillis(50));
        Duration delay = Backoff.calculate(retry, 1);
        assertThat(delay).isBetween(Duration.ofMillis(200), Duration.ofMillis(250));
    }

    @Test
    void generateJitterOfZeroShouldBeZero() {
        assertThat(Backoff.generateJitter(Duration.ZERO)).isEqualTo(Duration.ZERO);
        assertThat(Backoff.generateJitter(null)).isEqualTo(Duration.ZERO);
    }

    @RepeatedTest(50)
    void generateJitterShouldNeverExceedMax() {
        Duration max = Duration.ofMillis(25);
        assertThat(Backoff.generateJitter(max)).isBetween(Duration.ZERO, max);
    }
}
