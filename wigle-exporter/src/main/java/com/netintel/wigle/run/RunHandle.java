package com.netintel.wigle.run;

import com.netintel.wigle.model.RunSummary;

import java.util.concurrent.CompletableFuture;

/**
 * A submitted run: its id, progress channel, cancellation flag and eventual summary.
 */
public record RunHandle(String runId, String label, CancellationToken token, RunReporter reporter,
                        CompletableFuture<RunSummary> result) {

    public boolean isDone() {
        return result.isDone();
    }
}
