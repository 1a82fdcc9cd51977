package com.netintel.wigle.config;

import com.netintel.wigle.exception.CredentialsMissingException;
import com.netintel.wigle.model.BundleLocation;
import com.netintel.wigle.model.DetailKind;
import com.netintel.wigle.model.MccMncRecord;
import com.netintel.wigle.model.RunContext;
import com.netintel.wigle.model.RunRequest;
import com.netintel.wigle.model.RunSummary;
import com.netintel.wigle.model.SearchKind;
import com.netintel.wigle.run.RunExecutor;
import com.netintel.wigle.run.RunHandle;
import com.netintel.wigle.service.BatchOrchestrator;
import com.netintel.wigle.service.CredentialProvider;
import com.netintel.wigle.service.DetailRunService;
import com.netintel.wigle.service.MccMncLookupService;
import com.netintel.wigle.service.RunContextFactory;
import com.netintel.wigle.service.SearchRunService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class RunController {

    private final RunExecutor runExecutor;
    private final RunContextFactory contextFactory;
    private final SearchRunService searchRunService;
    private final DetailRunService detailRunService;
    private final BatchOrchestrator batchOrchestrator;
    private final MccMncLookupService mccMncLookupService;
    private final CredentialProvider credentialProvider;

    // ── Run triggers ─────────────────────────────────────────────────────────

    @PostMapping("/runs/search/{kind}")
    public ResponseEntity<Map<String, String>> triggerSearch(@PathVariable String kind,
                                                             @Valid @RequestBody(required = false) RunRequest request) {
        requireCredentials();
        SearchKind searchKind = SearchKind.parse(kind);
        RunRequest body = orEmpty(request);
        RunContext context = contextFor(searchKind.label(), body);

        RunHandle handle = runExecutor.submit(searchKind.label(), (reporter, token) ->
                searchRunService.runSearch(searchKind, paramsOf(body), context, reporter, token));
        return accepted(handle, context);
    }

    @PostMapping("/runs/detail/{kind}")
    public ResponseEntity<Map<String, String>> triggerDetail(@PathVariable String kind,
                                                             @Valid @RequestBody RunRequest request) {
        requireCredentials();
        DetailKind detailKind = DetailKind.parse(kind);
        Map<String, String> params = paramsOf(request);
        if (params.values().stream().allMatch(RunController::isBlank)) {
            throw new IllegalArgumentException("A detail lookup needs netid, or operator/lac/cid for cells");
        }
        RunContext context = contextFor(detailKind.label(), request);

        RunHandle handle = runExecutor.submit(detailKind.label(), (reporter, token) ->
                detailRunService.runDetail(detailKind, params, context, reporter));
        return accepted(handle, context);
    }

    @PostMapping("/runs/batch/{kind}")
    public ResponseEntity<Map<String, String>> triggerBatch(@PathVariable String kind,
                                                            @Valid @RequestBody RunRequest request) {
        requireCredentials();
        DetailKind detailKind = DetailKind.parse(kind);
        List<String> identifiers = isBlank(request.getIdentifiersFile())
                ? BatchOrchestrator.parseIdentifiers(request.getIdentifiers() != null ? request.getIdentifiers() : List.of())
                : BatchOrchestrator.readIdentifiers(Path.of(request.getIdentifiersFile()));
        if (identifiers.isEmpty()) {
            throw new IllegalArgumentException("Batch has no identifiers");
        }
        String label = detailKind.label() + "-batch";
        RunContext context = contextFor(label, request);

        RunHandle handle = runExecutor.submit(label, (reporter, token) ->
                batchOrchestrator.run(detailKind, identifiers, paramsOf(request), context, reporter, token));
        return accepted(handle, context);
    }

    // ── Run state ────────────────────────────────────────────────────────────

    @GetMapping("/runs/current")
    public ResponseEntity<Map<String, Object>> current() {
        return runExecutor.current()
                .map(handle -> ResponseEntity.ok(describe(handle)))
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @DeleteMapping("/runs/current")
    public ResponseEntity<Map<String, String>> cancel() {
        if (!runExecutor.cancelCurrent()) {
            return ResponseEntity.notFound().build();
        }
        return ResponseEntity.accepted().body(Map.of("status", "cancelling"));
    }

    @GetMapping("/credentials/status")
    public ResponseEntity<Map<String, Object>> credentialStatus() {
        return ResponseEntity.ok(Map.of("ready", credentialProvider.ready()));
    }

    // ── MCC/MNC lookup ───────────────────────────────────────────────────────

    /**
     * GET /mccmnc?mcc=310&mnc=410
     *
     * With export=true the records are also written to {output-dir}/mccmnc-{mcc}{mnc}.csv.
     */
    @GetMapping("/mccmnc")
    public ResponseEntity<Map<String, Object>> mccMnc(@RequestParam(required = false) String mcc,
                                                      @RequestParam(required = false) String mnc,
                                                      @RequestParam(defaultValue = "false") boolean export) {
        requireCredentials();
        List<MccMncRecord> records = mccMncLookupService.lookup(mcc, mnc);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("count", records.size());
        body.put("results", records);
        if (export) {
            Path dest = contextFactory.defaults("mccmnc").getOutputRoot()
                    .resolve("mccmnc-" + BundleLocation.sanitize(nullToEmpty(mcc) + nullToEmpty(mnc)) + ".csv");
            mccMncLookupService.exportCsv(records, dest)
                    .ifPresent(p -> body.put("file", p.toString()));
        }
        return ResponseEntity.ok(body);
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private void requireCredentials() {
        if (!credentialProvider.ready()) {
            throw new CredentialsMissingException();
        }
    }

    private RunContext contextFor(String label, RunRequest request) {
        return contextFactory.create(label, request.getCsv(), request.getKml(), request.getRetainPages(),
                request.getResultsPerPage(), request.getMaxPages());
    }

    private static ResponseEntity<Map<String, String>> accepted(RunHandle handle, RunContext context) {
        log.info("Accepted run {} into {}", handle.runId(), context.runDirectory());
        return ResponseEntity.accepted().body(Map.of(
                "status", "accepted",
                "runId", handle.runId(),
                "outputDir", context.runDirectory().toString()));
    }

    private static Map<String, Object> describe(RunHandle handle) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("runId", handle.runId());
        body.put("label", handle.label());
        body.put("done", handle.isDone());
        body.put("events", handle.reporter().events());
        handle.reporter().terminalMessage().ifPresent(m -> body.put("summary", m));
        if (handle.isDone() && !handle.result().isCompletedExceptionally()) {
            RunSummary summary = handle.result().join();
            body.put("status", summary.getStatus());
            body.put("files", summary.getFiles());
        }
        return body;
    }

    private static Map<String, String> paramsOf(RunRequest request) {
        return request.getParams() != null ? request.getParams() : Map.of();
    }

    private static RunRequest orEmpty(RunRequest request) {
        return request != null ? request : new RunRequest();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value.trim();
    }
}
