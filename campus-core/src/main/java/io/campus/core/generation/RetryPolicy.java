package io.campus.core.generation;

import java.time.Duration;

public record RetryPolicy(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
    public RetryPolicy {
        maxAttempts = Math.max(1, maxAttempts);
        initialBackoff = initialBackoff == null || initialBackoff.isNegative() ? Duration.ZERO : initialBackoff;
        maxBackoff = maxBackoff == null || maxBackoff.compareTo(initialBackoff) < 0 ? initialBackoff : maxBackoff;
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(250), Duration.ofMillis(2000));
    }

    /**
     * Delay after the given failed attempt (1-based). Doubles each time up to {@code maxBackoff}.
     */
    public Duration backoffAfter(int attempt) {
        Duration delay = initialBackoff;
        for (int i = 1; i < attempt && delay.compareTo(maxBackoff) < 0; i++) {
            delay = delay.multipliedBy(2);
        }
        return delay.compareTo(maxBackoff) > 0 ? maxBackoff : delay;
    }
}
