package com.netintel.wigle.service;

import com.netintel.wigle.exception.AuthorizationException;
import com.netintel.wigle.exception.ExportException;
import com.netintel.wigle.exception.NotFoundException;
import com.netintel.wigle.exception.WigleApiException;
import com.netintel.wigle.model.BatchResult;
import com.netintel.wigle.model.BundleLocation;
import com.netintel.wigle.model.DetailKind;
import com.netintel.wigle.model.RunBundle;
import com.netintel.wigle.model.RunContext;
import com.netintel.wigle.model.RunSummary;
import com.netintel.wigle.run.CancellationToken;
import com.netintel.wigle.run.RunReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs a detail lookup + export for each identifier in turn.
 *
 * Identifiers are processed strictly one after another, each into its own directory
 * {run directory}/{sanitized id}/. A failure on one identifier is recorded and the batch
 * moves on; an authorization failure stops the batch. Cancellation is checked between
 * identifiers.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class BatchOrchestrator {

    /** Parameters that address an identifier; replaced per item rather than inherited. */
    private static final Set<String> IDENTIFIER_PARAMS = Set.of("netid", "operator", "lac", "cid");

    private final DetailRunService detailRunService;

    public BatchResult runBatch(DetailKind kind, List<String> identifiers, Map<String, String> baseParams,
                                RunContext context, RunReporter reporter, CancellationToken token) {
        BatchResult result = new BatchResult(identifiers.size());
        try {
            createRunDirectory(context);
        } catch (ExportException e) {
            log.error("Batch cannot start: {}", e.getMessage(), e);
            result.recordFatal(e.getMessage());
            reporter.complete(result.summary());
            return result;
        }

        try {
            reporter.event("Output folder: " + context.runDirectory());

            Set<String> usedNames = new HashSet<>();
            int index = 0;
            for (String identifier : identifiers) {
                index++;
                if (token.isCancelled()) {
                    result.markCancelled();
                    reporter.event("Cancelled before " + identifier);
                    break;
                }
                reporter.event("[" + index + "/" + identifiers.size() + "] ID: " + identifier);
                if (!processOne(kind, identifier, baseParams, usedNames, context, reporter, result)) {
                    reporter.event("Authorization failed; remaining identifiers skipped.");
                    break;
                }
            }
        } catch (RuntimeException e) {
            log.error("Batch stopped unexpectedly: {}", e.getMessage(), e);
            result.recordFatal(e.getMessage());
        } finally {
            reporter.complete(result.summary());
        }
        return result;
    }

    /**
     * Batch run reported through the same summary shape as single runs.
     */
    public RunSummary run(DetailKind kind, List<String> identifiers, Map<String, String> baseParams,
                          RunContext context, RunReporter reporter, CancellationToken token) {
        LocalDateTime startedAt = LocalDateTime.now();
        BatchResult result = runBatch(kind, identifiers, baseParams, context, reporter, token);

        RunSummary run = RunSummary.builder()
                .runId(reporter.getRunId())
                .label(context.getLabel())
                .target(context.runDirectory().toString())
                .startedAt(startedAt)
                .completedAt(LocalDateTime.now())
                .status(result.status())
                .message(reporter.terminalMessage().orElse(result.summary()))
                .build();
        for (RunBundle bundle : result.getBundles()) {
            run.setPagesFetched(run.getPagesFetched() + 1);
            run.setRecordsFound(run.getRecordsFound() + bundle.getRecordCount());
            run.setRowsExported(run.getRowsExported() + bundle.getRowCount());
            run.setPlacemarksExported(run.getPlacemarksExported() + bundle.getPlacemarkCount());
            bundle.files().forEach(f -> run.getFiles().add(f.toString()));
        }
        if (result.isFatal()) {
            run.setErrorMessage(result.getFatalError());
        } else if (!result.getFailures().isEmpty()) {
            run.setErrorMessage(result.getFailures().size() + " identifier(s) failed");
        }
        return run;
    }

    /**
     * @return false when the batch must stop
     */
    private boolean processOne(DetailKind kind, String identifier, Map<String, String> baseParams,
                               Set<String> usedNames, RunContext context, RunReporter reporter,
                               BatchResult result) {
        Map<String, String> params = new LinkedHashMap<>();
        baseParams.forEach((k, v) -> {
            if (!IDENTIFIER_PARAMS.contains(k) && v != null && !v.isBlank()) {
                params.put(k, v.trim());
            }
        });
        params.putAll(kind.identifierParams(identifier));
        BundleLocation location = context.batchLocation(uniqueName(BundleLocation.detailBaseName(params), usedNames));

        try {
            RunBundle bundle = detailRunService.fetchAndExport(kind, params, location, context, reporter);
            if (bundle.hasErrors()) {
                result.recordPartial(identifier, bundle);
            } else {
                result.recordSuccess(bundle);
            }
        } catch (AuthorizationException e) {
            result.recordAbort(identifier, e.getMessage());
            return false;
        } catch (NotFoundException e) {
            reporter.event("No results for " + identifier);
            result.recordFailure(identifier, "not found");
        } catch (WigleApiException e) {
            reporter.event("Detail request failed for " + identifier + ": " + e.getMessage());
            result.recordFailure(identifier, e.getMessage());
        } catch (ExportException e) {
            reporter.event("Export failed for " + identifier + ": " + e.getMessage());
            result.recordFailure(identifier, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Batch item {} failed: {}", identifier, e.getMessage(), e);
            reporter.event("Detail request failed for " + identifier + ": " + e.getMessage());
            result.recordFailure(identifier, e.getMessage());
        }
        return true;
    }

    private void createRunDirectory(RunContext context) {
        try {
            Files.createDirectories(context.runDirectory());
        } catch (IOException e) {
            throw new ExportException("Cannot create output directory", context.runDirectory(), e);
        }
    }

    /** Repeated identifiers in one batch get -2, -3, ... so their bundles never collide. */
    static String uniqueName(String base, Set<String> usedNames) {
        if (usedNames.add(base)) {
            return base;
        }
        int n = 2;
        while (!usedNames.add(base + "-" + n)) {
            n++;
        }
        return base + "-" + n;
    }

    // ── Identifier lists ─────────────────────────────────────────────────────

    /**
     * One identifier per line; blank lines and lines starting with # are ignored.
     */
    public static List<String> parseIdentifiers(List<String> lines) {
        return lines.stream()
                .map(String::trim)
                .filter(line -> !line.isEmpty() && !line.startsWith("#"))
                .toList();
    }

    public static List<String> readIdentifiers(Path file) {
        try {
            return parseIdentifiers(Files.readAllLines(file, StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new IllegalArgumentException("Failed to read batch file " + file + ": " + e.getMessage(), e);
        }
    }
}
