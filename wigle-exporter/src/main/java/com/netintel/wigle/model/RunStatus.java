package com.netintel.wigle.model;

public enum RunStatus {
    RUNNING,
    SUCCEEDED,
    /** Some pages, identifiers or artifacts failed; the rest were written. */
    PARTIAL,
    /** Nothing came back; no files written. */
    EMPTY,
    CANCELLED,
    /** Authorization failure. */
    ABORTED,
    FAILED
}
