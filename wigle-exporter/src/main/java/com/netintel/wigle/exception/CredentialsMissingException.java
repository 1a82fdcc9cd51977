package com.netintel.wigle.exception;

public class CredentialsMissingException extends RuntimeException {

    public CredentialsMissingException() {
        super("WiGLE API credentials are not configured (wigle-exporter.credentials.api-name / api-token)");
    }
}
