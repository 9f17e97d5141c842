package com.dpstore.lock;

import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Bounded, jittered backoff for lock acquisition.
 *
 * The sleep before attempt n grows linearly with {@code n mod (maxRetries / 100)}
 * and then wraps, so it stays sub-second, and random jitter of up to the same
 * amount spreads out processes contending for one lock.
 */
public final class RetryPolicy {

    public static final int DEFAULT_MAX_RETRIES = 10000;
    public static final long DEFAULT_BASE_SLEEP_NANOS = TimeUnit.MICROSECONDS.toNanos(200);
    public static final int DEFAULT_READ_BACK_ATTEMPTS = 5;

    private static final RetryPolicy DEFAULT = new RetryPolicy(DEFAULT_MAX_RETRIES, DEFAULT_BASE_SLEEP_NANOS,
            DEFAULT_READ_BACK_ATTEMPTS);

    private final int maxRetries;
    private final long baseSleepNanos;
    private final int readBackAttempts;
    private final int cycle;

    /**
     * @param maxRetries       attempts before giving up
     * @param baseSleepNanos   unit of backoff
     * @param readBackAttempts reads of a freshly written lock token before treating it as lost
     */
    public RetryPolicy(int maxRetries, long baseSleepNanos, int readBackAttempts) {
        if (maxRetries <= 0) {
            throw new IllegalArgumentException("maxRetries must be positive, got: " + maxRetries);
        }
        if (baseSleepNanos < 0) {
            throw new IllegalArgumentException("baseSleepNanos must be non-negative, got: " + baseSleepNanos);
        }
        if (readBackAttempts <= 0) {
            throw new IllegalArgumentException("readBackAttempts must be positive, got: " + readBackAttempts);
        }
        this.maxRetries = maxRetries;
        this.baseSleepNanos = baseSleepNanos;
        this.readBackAttempts = readBackAttempts;
        this.cycle = Math.max(1, maxRetries / 100);
    }

    public static RetryPolicy defaults() {
        return DEFAULT;
    }

    /**
     * Sleep before the given attempt, without the deadline cap.
     *
     * @param attempt 1-based number of the attempt that just failed
     */
    public long backoffNanos(int attempt) {
        long step = baseSleepNanos * (attempt % cycle);
        long jitter = step > 0 ? ThreadLocalRandom.current().nextLong(step + 1) : 0;
        return step + jitter;
    }

    /**
     * Sleep before the given attempt, capped by the time left until the deadline.
     *
     * @param remainingNanos time left, {@link Long#MAX_VALUE} when there is no deadline
     */
    public long backoffNanos(int attempt, long remainingNanos) {
        return Math.max(0, Math.min(backoffNanos(attempt), remainingNanos));
    }

    /**
     * Short pause between reads of a lock token that was just written.
     */
    public long readBackPauseNanos() {
        return baseSleepNanos * 5;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public long getBaseSleepNanos() {
        return baseSleepNanos;
    }

    public int getReadBackAttempts() {
        return readBackAttempts;
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxRetries=" + maxRetries +
               ", baseSleepNanos=" + baseSleepNanos +
               ", readBackAttempts=" + readBackAttempts + '}';
    }
}
