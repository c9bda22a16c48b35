package com.questrail.rpc.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * One run of a {@link RetryPolicy}.
 *
 * - Counts attempts
 * - Hands out non-decreasing delays, never above the policy maximum
 * - Reports exhaustion of the attempt budget
 *
 * Not thread-safe; owned by a single dial loop.
 */
public final class RetrySequence {

    private final RetryPolicy policy;
    private final String tag;

    private int attempts;
    private Duration nextDelay;

    RetrySequence(RetryPolicy policy, String tag) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.tag = Objects.requireNonNull(tag, "tag");
        this.nextDelay = policy.initialBackoff();
    }

    /**
     * Record that an attempt is being made.
     *
     * @return the updated attempt count
     */
    public int recordAttempt() {
        return ++attempts;
    }

    public int attempts() {
        return attempts;
    }

    /**
     * True once the budget is spent. Never true for an unlimited policy.
     */
    public boolean exhausted() {
        return !policy.isUnlimited() && attempts >= policy.maxAttempts();
    }

    /**
     * Returns the delay to wait before the next attempt and advances the backoff.
     */
    public Duration nextDelay() {
        Duration delay = nextDelay;
        nextDelay = policy.grow(delay);
        return delay;
    }

    public String tag() {
        return tag;
    }

    public RetryPolicy policy() {
        return policy;
    }

    /**
     * Exception describing exhaustion of this sequence.
     */
    public RetryExhaustedException exhaustedError(Throwable lastFailure) {
        return new RetryExhaustedException(tag, attempts, lastFailure);
    }
}
