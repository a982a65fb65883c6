package com.ivamare.ordersession.policy;

import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Bounded retry with a backoff schedule and optional jitter.
 *
 * <p>Used both for command retries after a version conflict and for
 * projection retries before an event is dead-lettered.
 *
 * @param maxAttempts Maximum number of attempts, including the first one
 * @param backoffScheduleMs Delay in milliseconds before each retry
 * @param jitter Fraction (0-1) by which each delay is randomly spread
 */
public record RetryPolicy(
    int maxAttempts,
    List<Long> backoffScheduleMs,
    double jitter
) {
    private static final long DEFAULT_BACKOFF_MS = 50;

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
        if (jitter < 0 || jitter > 1) {
            throw new IllegalArgumentException("jitter must be between 0 and 1");
        }
        backoffScheduleMs = backoffScheduleMs != null ? List.copyOf(backoffScheduleMs) : List.of();
    }

    /**
     * Default command policy: 5 attempts, backoff [10, 25, 50, 100] ms, 50% jitter.
     *
     * @return Default retry policy
     */
    public static RetryPolicy defaultPolicy() {
        return new RetryPolicy(5, List.of(10L, 25L, 50L, 100L), 0.5);
    }

    /**
     * Create a policy with no retries.
     *
     * @return No retry policy
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(1, List.of(), 0);
    }

    /**
     * Get the nominal backoff before the attempt following {@code attempt}.
     *
     * @param attempt The attempt that just failed (1-based)
     * @return Delay in milliseconds, 0 when no retry remains
     */
    public long getBackoff(int attempt) {
        if (attempt >= maxAttempts) {
            return 0;
        }
        if (backoffScheduleMs.isEmpty()) {
            return DEFAULT_BACKOFF_MS;
        }
        int index = Math.max(0, attempt - 1);
        // Past the end of the schedule the last delay repeats
        return backoffScheduleMs.get(Math.min(index, backoffScheduleMs.size() - 1));
    }

    /**
     * Backoff with jitter applied, spread uniformly in [delay * (1 - jitter), delay * (1 + jitter)].
     *
     * @param attempt The attempt that just failed (1-based)
     * @return Delay in milliseconds
     */
    public long getJitteredBackoff(int attempt) {
        long base = getBackoff(attempt);
        if (base == 0 || jitter == 0) {
            return base;
        }
        double spread = base * jitter;
        double delay = base - spread + ThreadLocalRandom.current().nextDouble() * 2 * spread;
        return Math.max(0, Math.round(delay));
    }

    /**
     * Check if another retry should be attempted.
     *
     * @param attempt The current attempt number (1-based)
     * @return true if more attempts are allowed
     */
    public boolean shouldRetry(int attempt) {
        return attempt < maxAttempts;
    }
}
