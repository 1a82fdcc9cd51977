package com.netintel.wigle.service;

import com.netintel.wigle.config.WigleExporterProperties;
import com.netintel.wigle.model.RunContext;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;

/**
 * Builds run settings from configured defaults plus per-request overrides.
 * A null override keeps the configured value.
 */
@Component
@RequiredArgsConstructor
public class RunContextFactory {

    private final WigleExporterProperties properties;
    private final Clock clock;

    public RunContext create(String label, Boolean csv, Boolean kml, Boolean retainPages,
                             Integer resultsPerPage, Integer maxPages) {
        WigleExporterProperties.Output output = properties.getOutput();
        WigleExporterProperties.Fetch fetch = properties.getFetch();

        int perPage = resultsPerPage != null ? resultsPerPage : fetch.getResultsPerPage();
        int limit = maxPages != null ? maxPages : fetch.getMaxPages();
        if (perPage < 1) {
            throw new IllegalArgumentException("resultsPerPage must be at least 1");
        }
        if (limit < 0) {
            throw new IllegalArgumentException("maxPages must be 0 (no limit) or positive");
        }

        return RunContext.builder()
                .outputRoot(Path.of(output.getOutputDir()))
                .label(label)
                .startedAt(Instant.now(clock))
                .exportCsv(csv != null ? csv : output.isCsv())
                .exportKml(kml != null ? kml : output.isKml())
                .retainPages(retainPages != null ? retainPages : output.isRetainPages())
                .resultsPerPage(perPage)
                .maxPages(limit)
                .precheckTotal(fetch.isPrecheckTotal())
                .build();
    }

    public RunContext defaults(String label) {
        return create(label, null, null, null, null, null);
    }
}
