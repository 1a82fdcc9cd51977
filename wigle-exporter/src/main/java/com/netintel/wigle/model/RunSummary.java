package com.netintel.wigle.model;

import lombok.Builder;
import lombok.Data;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Terminal record of one run, handed to the caller once the worker finishes.
 */
@Data
@Builder
public class RunSummary {

    private String runId;
    private String label;           // wifi-basic, bt-detail, ...
    private String target;          // run directory
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private RunStatus status;
    private int pagesFetched;
    private int recordsFound;
    private int rowsExported;
    private int placemarksExported;
    @Builder.Default
    private List<String> files = new ArrayList<>();
    private String message;         // the terminal event text
    private String errorMessage;    // null on success
}
