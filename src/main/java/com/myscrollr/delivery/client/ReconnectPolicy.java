package com.myscrollr.delivery.client;

import java.time.Duration;

/**
 * Exponential reconnect backoff: the wait after {@code k} consecutive failures is
 * {@code min(base * 2^k, max)}. There is no attempt limit; the stream is retried forever.
 *
 * Not thread-safe; owned by the client event loop.
 */
public class ReconnectPolicy {

    private final Duration baseDelay;
    private final Duration maxDelay;
    private int consecutiveFailures;

    public ReconnectPolicy(Duration baseDelay, Duration maxDelay) {
        if (baseDelay.isNegative() || baseDelay.isZero()) {
            throw new IllegalArgumentException("baseDelay must be positive");
        }
        if (maxDelay.compareTo(baseDelay) < 0) {
            throw new IllegalArgumentException("maxDelay must not be smaller than baseDelay");
        }
        this.baseDelay = baseDelay;
        this.maxDelay = maxDelay;
    }

    /**
     * @return the wait before the next attempt, given the failures recorded so far
     */
    public Duration nextDelay() {
        return delayFor(consecutiveFailures);
    }

    Duration delayFor(int failures) {
        long max = maxDelay.toMillis();
        // 2^k overflows long well before it matters; anything past 62 doublings is the cap
        if (failures >= 62) {
            return maxDelay;
        }
        long factor = 1L << failures;
        long base = baseDelay.toMillis();
        if (base > max / factor) {
            return maxDelay;
        }
        return Duration.ofMillis(Math.min(base * factor, max));
    }

    public void recordFailure() {
        if (consecutiveFailures < Integer.MAX_VALUE) {
            consecutiveFailures++;
        }
    }

    public void recordSuccess() {
        consecutiveFailures = 0;
    }

    public void reset() {
        recordSuccess();
    }

    public int consecutiveFailures() {
        return consecutiveFailures;
    }
}
