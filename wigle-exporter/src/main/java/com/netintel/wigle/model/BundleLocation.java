package com.netintel.wigle.model;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Directory and base file name of one run bundle.
 *
 * Layout: {directory}/{baseName}-page_{n}.json, {baseName}.csv, {baseName}.kml
 */
public record BundleLocation(Path directory, String baseName) {

    private static final List<String> CELL_KEYS = List.of("operator", "lac", "cid", "system", "network", "basestation");

    public Path pagePath(int pageNumber) {
        return directory.resolve(baseName + "-page_" + pageNumber + ".json");
    }

    public Path csvPath() {
        return directory.resolve(baseName + ".csv");
    }

    public Path kmlPath() {
        return directory.resolve(baseName + ".kml");
    }

    /**
     * Base name for a detail lookup: the netid, else operator-X_lac-Y_..., else "detail".
     */
    public static String detailBaseName(Map<String, String> params) {
        String netid = params.get("netid");
        if (netid != null && !netid.isBlank()) {
            return sanitize(netid);
        }
        String cell = CELL_KEYS.stream()
                .filter(k -> params.get(k) != null && !params.get(k).isBlank())
                .map(k -> k + "-" + params.get(k))
                .collect(Collectors.joining("_"));
        return cell.isEmpty() ? "detail" : sanitize(cell);
    }

    /**
     * Strips colons and replaces anything outside [A-Za-z0-9_-] with an underscore.
     * e.g. "AA:BB:CC:DD:EE:FF" → "AABBCCDDEEFF"
     */
    public static String sanitize(String raw) {
        String cleaned = raw.trim().replace(":", "").replaceAll("[^A-Za-z0-9_-]+", "_");
        return cleaned.isEmpty() ? "detail" : cleaned;
    }
}
