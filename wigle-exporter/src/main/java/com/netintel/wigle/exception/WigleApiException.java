package com.netintel.wigle.exception;

/**
 * Base type for failures talking to the WiGLE API.
 * Thrown directly for non-retryable client errors (400, 422, unreadable bodies).
 */
public class WigleApiException extends RuntimeException {

    private final int httpStatus;

    public WigleApiException(String message) {
        this(message, 0, null);
    }

    public WigleApiException(String message, Throwable cause) {
        this(message, 0, cause);
    }

    public WigleApiException(String message, int httpStatus, Throwable cause) {
        super(message, cause);
        this.httpStatus = httpStatus;
    }

    /** HTTP status of the failed call, or 0 when no response was received. */
    public int getHttpStatus() {
        return httpStatus;
    }
}
