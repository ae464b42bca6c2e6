package com.prediction.market.amm.result;

/**
 * Broad classes of expected engine failures.
 * The kind decides how a caller reacts; the {@link ErrorCode} says why.
 */
public enum ErrorKind {

    /** Bad input. Never retried, surfaced verbatim. */
    VALIDATION(400, false),

    /** The referenced market does not exist. */
    NOT_FOUND(404, false),

    /** Wrong market status for the requested operation. */
    STATE_CONFLICT(409, false),

    /** Market lock not acquired within the timeout. Safe to retry. */
    RESOURCE_BUSY(503, true),

    /** Consensus could not pick a single outcome; needs an admin decision. */
    RESOLUTION_TIED(409, false);

    private final int httpStatus;
    private final boolean retryable;

    ErrorKind(int httpStatus, boolean retryable) {
        this.httpStatus = httpStatus;
        this.retryable = retryable;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
