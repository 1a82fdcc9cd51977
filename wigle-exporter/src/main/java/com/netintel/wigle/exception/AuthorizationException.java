package com.netintel.wigle.exception;

/**
 * 401 or 403 from the API. Never retried; aborts the whole run or batch.
 */
public class AuthorizationException extends WigleApiException {

    public AuthorizationException(String message, int httpStatus, Throwable cause) {
        super(message, httpStatus, cause);
    }
}
