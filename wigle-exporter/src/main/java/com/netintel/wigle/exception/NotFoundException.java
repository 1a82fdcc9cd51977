package com.netintel.wigle.exception;

public class NotFoundException extends WigleApiException {

    public NotFoundException(String message) {
        super(message, 404, null);
    }

    public NotFoundException(String message, Throwable cause) {
        super(message, 404, cause);
    }
}
