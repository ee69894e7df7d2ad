package com.prudhvi.llm_gateway.error;

/**
 * Classification of a failed call attempt.
 *
 * retryable            - whether the retry executor may try again
 * countsAgainstBreaker - whether the failure is reported to the breaker
 */
public enum ErrorKind {

    /** The attempt overran its deadline. */
    TIMEOUT(true, true),

    /** Connection-level failure: refused, reset, DNS. */
    NETWORK(true, true),

    /** The provider answered with a transient error status. */
    PROVIDER(true, true),

    /** The request itself is invalid; repeating it cannot help. */
    NON_RETRYABLE(false, true),

    /** The caller gave up. Says nothing about the provider's health. */
    CANCELLED(false, false),

    /** Rejected by an open breaker before any network activity. */
    CIRCUIT_OPEN(false, false);

    private final boolean retryable;
    private final boolean countsAgainstBreaker;

    ErrorKind(boolean retryable, boolean countsAgainstBreaker) {
        this.retryable = retryable;
        this.countsAgainstBreaker = countsAgainstBreaker;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public boolean countsAgainstBreaker() {
        return countsAgainstBreaker;
    }
}
