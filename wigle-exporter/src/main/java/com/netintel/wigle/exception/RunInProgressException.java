package com.netintel.wigle.exception;

public class RunInProgressException extends RuntimeException {

    public RunInProgressException(String activeRunId) {
        super("A run is already in progress: " + activeRunId);
    }
}
