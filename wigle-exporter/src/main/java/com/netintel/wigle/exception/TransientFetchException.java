package com.netintel.wigle.exception;

/**
 * Timeout, connection failure, 429 or 5xx. Eligible for retry.
 */
public class TransientFetchException extends WigleApiException {

    public TransientFetchException(String message, int httpStatus, Throwable cause) {
        super(message, httpStatus, cause);
    }
}
