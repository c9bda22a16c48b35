package com.questrail.rpc.retry;

import java.time.Duration;
import java.util.Objects;

/**
 * RetryPolicy
 * -----------------------------------------------------------------------------
 * Exponential backoff configuration for establishing a peer connection.
 *
 * <h2>Configuration Parameters</h2>
 * <ul>
 *   <li><b>initialBackoff</b>: delay after the first failed attempt.</li>
 *   <li><b>maxBackoff</b>: ceiling; no delay ever exceeds it.</li>
 *   <li><b>multiplier</b>: growth factor applied after every delay (at least 1).</li>
 *   <li><b>maxAttempts</b>: attempt budget; {@code 0} retries indefinitely.</li>
 * </ul>
 *
 * <p>A policy is immutable. Each dial sequence takes its own
 * {@link RetrySequence} from it via {@link #start(String)}.</p>
 */
public record RetryPolicy(
        Duration initialBackoff,
        Duration maxBackoff,
        double multiplier,
        int maxAttempts
) {
    public RetryPolicy {
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");

        if (initialBackoff.isNegative()) {
            throw new IllegalArgumentException("initialBackoff must be non-negative");
        }
        if (maxBackoff.compareTo(initialBackoff) < 0) {
            throw new IllegalArgumentException("maxBackoff must be >= initialBackoff");
        }
        if (Double.isNaN(multiplier) || multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1");
        }
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be non-negative");
        }
    }

    /**
     * Backoff starting at 1s, doubling, capped at 30s, retrying indefinitely.
     */
    public static RetryPolicy defaults() {
        return new RetryPolicy(Duration.ofSeconds(1), Duration.ofSeconds(30), 2.0, 0);
    }

    public RetryPolicy withMaxAttempts(int maxAttempts) {
        return new RetryPolicy(initialBackoff, maxBackoff, multiplier, maxAttempts);
    }

    public boolean isUnlimited() {
        return maxAttempts == 0;
    }

    /**
     * The delay that follows {@code current}: grown by the multiplier and
     * clamped to {@link #maxBackoff()}.
     */
    public Duration grow(Duration current) {
        Objects.requireNonNull(current, "current");

        double grown = current.toNanos() * multiplier;
        long cap = maxBackoff.toNanos();
        return grown >= cap ? maxBackoff : Duration.ofNanos((long) grown);
    }

    /**
     * Begins a new retry sequence.
     *
     * @param tag human readable label used in diagnostics, e.g. {@code "client 10.0.0.1:26257 connection"}
     */
    public RetrySequence start(String tag) {
        return new RetrySequence(this, tag);
    }
}
