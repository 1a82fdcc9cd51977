package com.netintel.wigle.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netintel.wigle.exception.AuthorizationException;
import com.netintel.wigle.exception.ExportException;
import com.netintel.wigle.exception.NotFoundException;
import com.netintel.wigle.exception.WigleApiException;
import com.netintel.wigle.model.BundleLocation;
import com.netintel.wigle.model.DetailKind;
import com.netintel.wigle.model.Page;
import com.netintel.wigle.model.RunBundle;
import com.netintel.wigle.model.RunContext;
import com.netintel.wigle.model.RunStatus;
import com.netintel.wigle.model.RunSummary;
import com.netintel.wigle.output.ExportPipeline;
import com.netintel.wigle.output.PageStore;
import com.netintel.wigle.run.RunReporter;
import io.github.resilience4j.retry.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Detail lookups for a single identifier: one request, one page file, export, cleanup.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DetailRunService {

    private final WigleApiClient apiClient;
    private final ExportPipeline exportPipeline;
    private final ObjectMapper objectMapper;
    private final Retry wigleApiRetry;

    /**
     * Fetch and export one identifier into the given location. Emits progress events but no
     * terminal event, so the batch orchestrator can reuse it.
     *
     * @throws NotFoundException      the service has nothing for these parameters
     * @throws AuthorizationException 401/403
     * @throws WigleApiException      any other fetch failure, after retries
     * @throws ExportException        the bundle directory or page file could not be written
     */
    public RunBundle fetchAndExport(DetailKind kind, Map<String, String> params, BundleLocation location,
                                    RunContext context, RunReporter reporter) {
        PageStore store = PageStore.open(objectMapper, location);
        reporter.event("Submitted: " + apiClient.detailUri(kind, params));

        List<JsonNode> records = wigleApiRetry.executeSupplier(() -> apiClient.fetchDetail(kind, params));
        Path page = store.append(new Page(1, records, null, (long) records.size()));
        reporter.event("Saved RAW detail JSON page: " + page + " (" + records.size() + " record(s))");

        return exportPipeline.export(context, store, reporter);
    }

    public RunSummary runDetail(DetailKind kind, Map<String, String> params, RunContext context, RunReporter reporter) {
        BundleLocation location = context.detailLocation(BundleLocation.detailBaseName(params));
        RunSummary run = RunSummary.builder()
                .runId(reporter.getRunId())
                .label(context.getLabel())
                .target(location.directory().toString())
                .startedAt(LocalDateTime.now())
                .status(RunStatus.RUNNING)
                .build();

        try {
            reporter.event("Output folder: " + location.directory());
            RunBundle bundle = fetchAndExport(kind, params, location, context, reporter);
            run.setPagesFetched(1);
            run.setRecordsFound(bundle.getRecordCount());
            run.setRowsExported(bundle.getRowCount());
            run.setPlacemarksExported(bundle.getPlacemarkCount());
            bundle.files().stream().map(Path::toString).forEach(run.getFiles()::add);
            if (bundle.hasErrors()) {
                run.setStatus(RunStatus.PARTIAL);
                run.setErrorMessage(String.join("; ", bundle.getErrors()));
            } else {
                run.setStatus(RunStatus.SUCCEEDED);
            }

        } catch (NotFoundException e) {
            reporter.event("No results.");
            run.setStatus(RunStatus.EMPTY);

        } catch (AuthorizationException e) {
            log.error("Detail lookup aborted: {}", e.getMessage());
            run.setStatus(RunStatus.ABORTED);
            run.setErrorMessage(e.getMessage());

        } catch (WigleApiException | ExportException e) {
            log.error("Detail lookup failed for {}: {}", params, e.getMessage(), e);
            reporter.event("Detail request failed: " + e.getMessage());
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(e.getMessage());

        } catch (RuntimeException e) {
            log.error("Detail lookup failed unexpectedly for {}: {}", params, e.getMessage(), e);
            run.setStatus(RunStatus.FAILED);
            run.setErrorMessage(e.getMessage());

        } finally {
            run.setCompletedAt(LocalDateTime.now());
            run.setMessage(RunSummaries.describe("Detail lookup", run));
            reporter.complete(run.getMessage());
        }
        return run;
    }
}
