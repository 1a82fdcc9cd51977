package com.netintel.wigle.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netintel.wigle.exception.AuthorizationException;
import com.netintel.wigle.exception.ExportException;
import com.netintel.wigle.model.BundleLocation;
import com.netintel.wigle.model.RunBundle;
import com.netintel.wigle.model.RunContext;
import com.netintel.wigle.model.RunStatus;
import com.netintel.wigle.model.RunSummary;
import com.netintel.wigle.model.SearchKind;
import com.netintel.wigle.output.ExportPipeline;
import com.netintel.wigle.output.PageStore;
import com.netintel.wigle.run.CancellationToken;
import com.netintel.wigle.run.RunReporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.Map;

/**
 * One search run: count check, paginated fetch into the page store, export, cleanup.
 * Ends with exactly one terminal event whatever happens.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class SearchRunService {

    private final WigleApiClient apiClient;
    private final PaginatedFetcher fetcher;
    private final ExportPipeline exportPipeline;
    private final ObjectMapper objectMapper;

    public RunSummary runSearch(SearchKind kind, Map<String, String> params, RunContext context,
                                RunReporter reporter, CancellationToken token) {
        RunSummary run = RunSummary.builder()
                .runId(reporter.getRunId())
                .label(context.getLabel())
                .target(context.runDirectory().toString())
                .startedAt(LocalDateTime.now())
                .status(RunStatus.RUNNING)
                .build();

        try {
            BundleLocation location = context.searchLocation();
            PageStore store = PageStore.open(objectMapper, location);
            reporter.event("Output folder: " + location.directory());

            if (context.isPrecheckTotal()) {
                Long total = apiClient.fetchTotalCount(kind, params);
                reporter.event("Total in source: " + (total != null ? total : "unknown"));
            }

            PaginatedFetcher.FetchResult fetch = fetcher.fetchInto(store, kind, params, context, reporter, token);
            run.setPagesFetched(fetch.pagesFetched());
            run.setRecordsFound(fetch.recordsFetched());
            reporter.event("Search complete: " + fetch.recordsFetched() + " results");

            RunBundle bundle = exportPipeline.export(context, store, reporter);
            run.setRowsExported(bundle.getRowCount());
            run.setPlacemarksExported(bundle.getPlacemarkCount());
            bundle.files().stream().map(Path::toString).forEach(run.getFiles()::add);

            run.setStatus(statusOf(fetch, bundle));
            if (fetch.failed()) {
                run.setErrorMessage(fetch.failure().getMessage());
            } else if (bundle.hasErrors()) {
                run.setErrorMessage(String.join("; ", bundle.getErrors()));
            }

        } catch (AuthorizationException e) {
            log.error("Search {} aborted: {}", kind, e.getMessage());
            run.setStatus(RunStatus.ABORTED);
            run.setErrorMessage(e.getMessage());

        } catch (ExportException e) {
            log.error("Search {} failed writing output: {}", kind, e.getMessage(), e);
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(e.getMessage());

        } catch (RuntimeException e) {
            log.error("Search {} failed: {}", kind, e.getMessage(), e);
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(e.getMessage());

        } finally {
            run.setCompletedAt(LocalDateTime.now());
            run.setMessage(RunSummaries.describe("Search", run));
            reporter.complete(run.getMessage());
        }
        return run;
    }

    private static RunStatus statusOf(PaginatedFetcher.FetchResult fetch, RunBundle bundle) {
        if (fetch.failed()) {
            return fetch.recordsFetched() > 0 ? RunStatus.PARTIAL : RunStatus.FAILED;
        }
        if (fetch.stopReason() == PaginatedFetcher.StopReason.CANCELLED) {
            return RunStatus.CANCELLED;
        }
        if (bundle.hasErrors()) {
            return RunStatus.PARTIAL;
        }
        return fetch.recordsFetched() == 0 ? RunStatus.EMPTY : RunStatus.SUCCEEDED;
    }
}
