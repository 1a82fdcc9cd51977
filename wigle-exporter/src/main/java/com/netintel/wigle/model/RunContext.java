package com.netintel.wigle.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.nio.file.Path;
import java.time.Instant;

/**
 * Immutable settings for one run, shared read-only by every stage of the pipeline.
 *
 * Naming: the run directory is {outputRoot}/{label}-{epochSeconds}. Re-running with the
 * same label and timestamp addresses the same directory; a fresh timestamp never does.
 */
@Value
@Builder(toBuilder = true)
public class RunContext {

    @NonNull Path outputRoot;
    @NonNull String label;
    @NonNull Instant startedAt;

    boolean exportCsv;
    boolean exportKml;
    boolean retainPages;

    @Builder.Default int resultsPerPage = 100;
    /** 0 means no limit. */
    @Builder.Default int maxPages = 0;
    @Builder.Default boolean precheckTotal = true;

    public String runTag() {
        return label + "-" + startedAt.getEpochSecond();
    }

    public Path runDirectory() {
        return outputRoot.resolve(runTag());
    }

    /** Search runs: every file sits directly in the run directory, named after the run tag. */
    public BundleLocation searchLocation() {
        return new BundleLocation(runDirectory(), runTag());
    }

    /** Single detail lookups share the run directory and are named after the identifier. */
    public BundleLocation detailLocation(String baseName) {
        return new BundleLocation(runDirectory(), baseName);
    }

    /** Batch items each get their own sub-directory of the run directory. */
    public BundleLocation batchLocation(String baseName) {
        return new BundleLocation(runDirectory().resolve(baseName), baseName);
    }
}
