package com.tokenauth.server;

/**
 * Caller-facing class of a failed grant, with its HTTP status equivalent.
 */
public enum Outcome {
    UNAUTHORIZED(401),
    FORBIDDEN(403),
    RETRYABLE_CONFLICT(409);

    private final int httpStatus;

    Outcome(int httpStatus) {
        this.httpStatus = httpStatus;
    }

    public int httpStatus() {
        return httpStatus;
    }
}
