package com.locksmith.mongo;

import com.locksmith.lease.LocksmithUtils;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Exponential backoff with jitter between two acquisition attempts of the same lock.
 * <p>
 * The delay doubles with each attempt, starting from a base delay, and is capped at a maximum.
 * A random jitter spreads competing waiters so that they do not retry in lockstep.
 * </p>
 */
public class BackoffStrategy {

    // Environment variable key for overriding the maximum delay between two attempts.
    public static final String MAX_BACKOFF_MILLIS_KEY = "LOCKSMITH_MAX_BACKOFF_MILLIS";
    public static final long DEFAULT_MAX_BACKOFF_MILLIS = 500;
    static final long MIN_MAX_BACKOFF_MILLIS = 10;

    /**
     * Creates the strategy capped by the {@code LOCKSMITH_MAX_BACKOFF_MILLIS} environment variable.
     */
    public static BackoffStrategy getDefault() {
        return getDefault(LocksmithUtils.getEffectiveMillis(MAX_BACKOFF_MILLIS_KEY, DEFAULT_MAX_BACKOFF_MILLIS, MIN_MAX_BACKOFF_MILLIS));
    }

    /**
     * Creates a strategy whose base delay is a thirtieth of {@code maxDelay} and whose jitter is half the base delay.
     *
     * @param maxDelay the maximum delay in milliseconds.
     * @return a new strategy.
     */
    public static BackoffStrategy getDefault(long maxDelay) {
        long baseBackoffMillis = Math.max(1, maxDelay / 30);
        long maxJitter = Math.max(1, baseBackoffMillis / 2);
        return new BackoffStrategy(baseBackoffMillis, maxJitter, maxDelay);
    }

    private final long baseBackoffMillis;
    private final long maxJitter;
    private final long maxDelay;
    private final int attemptCountThreshold;

    /**
     * @param baseBackoffMillis the delay after the first failed attempt, at least 1 millisecond.
     * @param maxJitter         the maximum random jitter, at least 1 millisecond.
     * @param maxDelay          the maximum delay, not less than {@code baseBackoffMillis}.
     */
    public BackoffStrategy(long baseBackoffMillis, long maxJitter, long maxDelay) {
        if (baseBackoffMillis < 1 || maxJitter < 1 || maxDelay < baseBackoffMillis) {
            throw new IllegalArgumentException(String.format("Invalid backoff: base %d, jitter %d, max %d",
                    baseBackoffMillis, maxJitter, maxDelay));
        }
        this.baseBackoffMillis = baseBackoffMillis;
        this.maxJitter = maxJitter;
        this.maxDelay = maxDelay;

        // Number of attempts after which the delay is always the maximum.
        this.attemptCountThreshold = (int) Math.ceil(Math.log(maxDelay / (double) baseBackoffMillis) / Math.log(2));
    }

    public long getBaseBackoffMillis() {
        return baseBackoffMillis;
    }

    public long getMaxDelay() {
        return maxDelay;
    }

    /**
     * Calculates the delay before the next attempt.
     *
     * @param attemptNo the number of failed attempts so far, starting at 0.
     * @return the delay in milliseconds, between 1 and the maximum delay.
     */
    public long calculateDelay(int attemptNo) {
        if (attemptNo > attemptCountThreshold) {
            return maxDelay;
        }
        var backoffMillis = baseBackoffMillis * (1L << attemptNo);
        var jitter = ThreadLocalRandom.current().nextLong(maxJitter << 1) - maxJitter; // [-maxJitter, +maxJitter)
        return Math.max(1, Math.min(backoffMillis + jitter, maxDelay));
    }

}
