package com.netintel.wigle.output;

import com.netintel.wigle.exception.ExportException;
import com.netintel.wigle.model.BundleLocation;
import com.netintel.wigle.model.FlattenResult;
import com.netintel.wigle.model.RunBundle;
import com.netintel.wigle.model.RunContext;
import com.netintel.wigle.run.RunReporter;
import com.netintel.wigle.service.FlattenEngine;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Routes the pages of one bundle to the exporters enabled in the run context, then finishes
 * the page store.
 *
 * A failing artifact does not stop the other one. Page files are deleted only when retention
 * is off and every enabled artifact was written; otherwise they stay as the only copy of the data.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ExportPipeline {

    private final FlattenEngine flattenEngine;
    private final TabularExporter tabularExporter;
    private final GeoExporter geoExporter;

    public RunBundle export(RunContext context, PageStore store, RunReporter reporter) {
        BundleLocation location = store.location();
        RunBundle.RunBundleBuilder bundle = RunBundle.builder()
                .location(location)
                .recordCount(store.recordCount());

        if (store.pages().isEmpty()) {
            reporter.event("No JSON pages to export.");
            store.finish(context.isRetainPages());
            return bundle.build();
        }

        FlattenResult result = flattenEngine.flatten(store.pages());
        bundle.rowCount(result.rows().size());
        boolean failed = false;

        if (context.isExportCsv()) {
            try {
                Optional<Path> csv = tabularExporter.export(result, location.csvPath());
                csv.ifPresentOrElse(
                        p -> reporter.event("Full CSV exported: " + p),
                        () -> reporter.event("CSV export: no rows."));
                bundle.csvFile(csv.orElse(null));
            } catch (ExportException e) {
                failed = true;
                bundle.error("CSV: " + e.getMessage());
                reporter.event("CSV export failed: " + e.getMessage());
            }
        }

        if (context.isExportKml()) {
            try {
                Optional<Path> kml = geoExporter.export(result.points(), location.baseName(), location.kmlPath());
                kml.ifPresentOrElse(
                        p -> reporter.event("KML exported: " + p + " (" + result.points().size() + " placemarks)"),
                        () -> reporter.event("KML export: no points with lat/lon."));
                bundle.kmlFile(kml.orElse(null));
                bundle.placemarkCount(kml.isPresent() ? result.points().size() : 0);
            } catch (ExportException e) {
                failed = true;
                bundle.error("KML: " + e.getMessage());
                reporter.event("KML export failed: " + e.getMessage());
            }
        }

        boolean retain = context.isRetainPages() || failed;
        if (failed && !context.isRetainPages()) {
            log.warn("Keeping page files for {} because an export failed", location.baseName());
        }
        bundle.retainedPages(retain ? store.pageFiles() : List.of());
        int removed = store.finish(retain);
        if (removed > 0) {
            reporter.event("Cleaned " + removed + " temporary JSON file(s).");
        }
        return bundle.build();
    }
}
