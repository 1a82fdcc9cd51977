package com.netintel.wigle.service;

import com.netintel.wigle.model.RunSummary;

/**
 * Terminal event text for single runs.
 */
final class RunSummaries {

    private RunSummaries() {
    }

    static String describe(String what, RunSummary run) {
        String head = switch (run.getStatus()) {
            case SUCCEEDED -> what + " complete";
            case PARTIAL -> what + " finished with errors";
            case EMPTY -> what + " complete, no results";
            case CANCELLED -> what + " cancelled";
            case ABORTED -> what + " aborted";
            case FAILED -> what + " failed";
            case RUNNING -> what + " running";
        };
        StringBuilder sb = new StringBuilder(head)
                .append(": ").append(run.getRecordsFound()).append(" records in ")
                .append(run.getPagesFetched()).append(" page(s), ")
                .append(run.getRowsExported()).append(" rows, ")
                .append(run.getPlacemarksExported()).append(" placemarks");
        if (!run.getFiles().isEmpty()) {
            sb.append(". Files: ").append(String.join(", ", run.getFiles()));
        }
        if (run.getErrorMessage() != null) {
            sb.append(". Error: ").append(run.getErrorMessage());
        }
        return sb.toString();
    }
}
