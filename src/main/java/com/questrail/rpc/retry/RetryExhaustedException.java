package com.questrail.rpc.retry;

/**
 * Signals that a retry sequence used up its attempt budget without success.
 */
public final class RetryExhaustedException extends RuntimeException
{
    private final int attempts;

    public RetryExhaustedException(String tag, int attempts, Throwable lastFailure) {
        super(tag + " failed after " + attempts + " attempt(s)", lastFailure);
        this.attempts = attempts;
    }

    public int attempts() {
        return attempts;
    }
}
