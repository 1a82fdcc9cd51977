package com.netintel.wigle.model;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of a multi-identifier batch. Grows monotonically while the batch runs.
 */
@Getter
public class BatchResult {

    public record Failure(String identifier, String error) {}

    private final int requested;
    private int processed;
    private int succeeded;
    private int failed;
    private int csvCount;
    private int kmlCount;
    private boolean aborted;
    private boolean cancelled;
    /** Set when the batch could not run at all, e.g. the run directory was not writable. */
    private String fatalError;
    private final List<RunBundle> bundles = new ArrayList<>();
    private final List<Failure> failures = new ArrayList<>();

    public BatchResult(int requested) {
        this.requested = requested;
    }

    public void recordSuccess(RunBundle bundle) {
        processed++;
        succeeded++;
        bundles.add(bundle);
        countFiles(bundle);
    }

    /** An identifier that fetched but lost one or more artifacts still counts as failed. */
    public void recordPartial(String identifier, RunBundle bundle) {
        processed++;
        failed++;
        bundles.add(bundle);
        countFiles(bundle);
        failures.add(new Failure(identifier, String.join("; ", bundle.getErrors())));
    }

    public void recordFailure(String identifier, String error) {
        processed++;
        failed++;
        failures.add(new Failure(identifier, error));
    }

    /** Authorization failure: the identifier failed and nothing after it runs. */
    public void recordAbort(String identifier, String error) {
        recordFailure(identifier, error);
        aborted = true;
    }

    public void recordFatal(String error) {
        fatalError = error;
    }

    public boolean isFatal() {
        return fatalError != null;
    }

    public void markCancelled() {
        cancelled = true;
    }

    public List<RunBundle> getBundles() {
        return Collections.unmodifiableList(bundles);
    }

    public List<Failure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public RunStatus status() {
        if (fatalError != null) return RunStatus.FAILED;
        if (aborted) return RunStatus.ABORTED;
        if (cancelled) return RunStatus.CANCELLED;
        if (failed == 0) return RunStatus.SUCCEEDED;
        return succeeded == 0 ? RunStatus.FAILED : RunStatus.PARTIAL;
    }

    public String summary() {
        String head;
        if (fatalError != null) {
            head = "Batch failed (" + fatalError + ")";
        } else if (aborted) {
            head = "Batch aborted";
        } else if (cancelled) {
            head = "Batch cancelled";
        } else {
            head = "Batch complete";
        }
        StringBuilder sb = new StringBuilder()
                .append(head).append(": ")
                .append(processed).append(" processed, ")
                .append(succeeded).append(" succeeded, ")
                .append(failed).append(" failed");
        if (processed < requested) {
            sb.append(", ").append(requested - processed).append(" not started");
        }
        sb.append(". Created ").append(csvCount).append(" CSV(s) and ").append(kmlCount).append(" KML(s).");
        for (Failure f : failures) {
            sb.append("\n  ").append(f.identifier()).append(": ").append(f.error());
        }
        return sb.toString();
    }

    private void countFiles(RunBundle bundle) {
        if (bundle.csv().isPresent()) csvCount++;
        if (bundle.kml().isPresent()) kmlCount++;
    }
}
