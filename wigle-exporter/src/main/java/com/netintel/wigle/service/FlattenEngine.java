package com.netintel.wigle.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.netintel.wigle.config.WigleExporterProperties;
import com.netintel.wigle.model.FlatRow;
import com.netintel.wigle.model.FlattenResult;
import com.netintel.wigle.model.GeoPoint;
import com.netintel.wigle.model.Page;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Turns pages of arbitrarily shaped JSON records into a union-of-keys table and a list of
 * coordinate-bearing points.
 *
 * Flattening rules:
 *  - nested objects become parent.child columns
 *  - arrays of scalars are joined with the list delimiter
 *  - one array of objects per record (the location history) is expanded into one row per
 *    item; each row carries the record's other fields plus the item's fields
 *  - any other array containing objects is kept as compact JSON text
 *
 * Column order is the order of first occurrence across the whole run, so repeated runs of
 * the same search produce the same header.
 */
@Component
@Slf4j
public class FlattenEngine {

    private static final String SCALAR_RECORD_COLUMN = "value";

    private final String separator;
    private final String listDelimiter;
    private final List<String> expansionKeys;
    private final List<String> latitudeKeys;
    private final List<String> longitudeKeys;
    private final List<String> nameKeys;

    public FlattenEngine(WigleExporterProperties properties) {
        WigleExporterProperties.Flatten flatten = properties.getFlatten();
        this.separator = flatten.getSeparator();
        this.listDelimiter = flatten.getListDelimiter();
        this.expansionKeys = List.copyOf(flatten.getExpansionKeys());
        this.latitudeKeys = List.copyOf(flatten.getLatitudeKeys());
        this.longitudeKeys = List.copyOf(flatten.getLongitudeKeys());
        this.nameKeys = List.copyOf(flatten.getNameKeys());
    }

    public FlattenResult flatten(List<Page> pages) {
        Set<String> columns = new LinkedHashSet<>();
        List<FlatRow> rows = new ArrayList<>();
        List<GeoPoint> points = new ArrayList<>();
        int records = 0;

        for (Page page : pages) {
            for (JsonNode record : page.records()) {
                records++;
                for (RowDraft draft : expand(record)) {
                    columns.addAll(draft.row().keySet());
                    rows.add(new FlatRow(draft.row()));
                    toGeoPoint(draft).ifPresent(points::add);
                }
            }
        }

        log.debug("Flattened {} records from {} pages into {} rows, {} columns, {} points",
                records, pages.size(), rows.size(), columns.size(), points.size());
        return new FlattenResult(new ArrayList<>(columns), rows, points);
    }

    /**
     * Rows for a single record, in the order they would appear in the table.
     */
    public List<FlatRow> rowsOf(JsonNode record) {
        List<FlatRow> rows = new ArrayList<>();
        for (RowDraft draft : expand(record)) {
            rows.add(new FlatRow(draft.row()));
        }
        return rows;
    }

    // ── Expansion ────────────────────────────────────────────────────────────

    /** A row plus the subset of it that came from the expanded item (empty when not expanded). */
    private record RowDraft(Map<String, String> row, Map<String, String> item) {}

    private List<RowDraft> expand(JsonNode record) {
        if (!record.isObject()) {
            Map<String, String> row = new LinkedHashMap<>();
            flattenInto(row, SCALAR_RECORD_COLUMN, record);
            return List.of(new RowDraft(row, Map.of()));
        }

        String expansionKey = findExpansionKey(record);
        Map<String, String> base = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!field.getKey().equals(expansionKey)) {
                flattenInto(base, field.getKey(), field.getValue());
            }
        }
        if (expansionKey == null) {
            return List.of(new RowDraft(base, Map.of()));
        }

        JsonNode expansion = record.get(expansionKey);
        List<JsonNode> items = new ArrayList<>();
        if (expansion.isArray()) {
            expansion.forEach(items::add);
        } else {
            items.add(expansion);
        }

        List<RowDraft> drafts = new ArrayList<>(items.size());
        for (JsonNode item : items) {
            Map<String, String> itemFields = new LinkedHashMap<>();
            item.fields().forEachRemaining(e -> flattenInto(itemFields, e.getKey(), e.getValue()));
            Map<String, String> row = new LinkedHashMap<>(base);
            row.putAll(itemFields);
            drafts.add(new RowDraft(row, itemFields));
        }
        return drafts;
    }

    /**
     * Configured keys win (an object under one of them counts as a one-item list);
     * otherwise the first top-level non-empty array made only of objects.
     */
    private String findExpansionKey(JsonNode record) {
        for (String key : expansionKeys) {
            JsonNode node = record.get(key);
            if (node != null && (node.isObject() && node.size() > 0 || isArrayOfObjects(node))) {
                return key;
            }
        }
        Iterator<Map.Entry<String, JsonNode>> fields = record.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (isArrayOfObjects(field.getValue())) {
                return field.getKey();
            }
        }
        return null;
    }

    private static boolean isArrayOfObjects(JsonNode node) {
        if (node == null || !node.isArray() || node.isEmpty()) {
            return false;
        }
        for (JsonNode element : node) {
            if (!element.isObject()) {
                return false;
            }
        }
        return true;
    }

    // ── Flattening ───────────────────────────────────────────────────────────

    private void flattenInto(Map<String, String> row, String path, JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            row.put(path, "");
        } else if (node.isObject()) {
            if (node.isEmpty()) {
                row.put(path, "");
                return;
            }
            node.fields().forEachRemaining(e -> flattenInto(row, path + separator + e.getKey(), e.getValue()));
        } else if (node.isArray()) {
            row.put(path, renderArray(node));
        } else {
            row.put(path, node.asText());
        }
    }

    private String renderArray(JsonNode array) {
        List<String> parts = new ArrayList<>(array.size());
        for (JsonNode element : array) {
            if (!element.isValueNode()) {
                // nested structure: keep it whole rather than lose it
                return array.toString();
            }
            parts.add(element.isNull() ? "" : element.asText());
        }
        return String.join(listDelimiter, parts);
    }

    // ── Coordinates ──────────────────────────────────────────────────────────

    private Optional<GeoPoint> toGeoPoint(RowDraft draft) {
        Double lat = coordinate(draft, latitudeKeys, 90);
        Double lon = coordinate(draft, longitudeKeys, 180);
        if (lat == null || lon == null) {
            return Optional.empty();
        }
        return Optional.of(new GeoPoint(lat, lon, firstNonBlank(draft.row(), nameKeys), draft.row()));
    }

    /** Item fields are consulted before the fields inherited from the parent record. */
    private Double coordinate(RowDraft draft, List<String> keys, double limit) {
        for (Map<String, String> source : List.of(draft.item(), draft.row())) {
            for (String key : keys) {
                Double value = parseCoordinate(source.get(key), limit);
                if (value != null) {
                    return value;
                }
            }
        }
        return null;
    }

    private static Double parseCoordinate(String raw, double limit) {
        if (raw == null || raw.isBlank()) return null;
        try {
            double value = Double.parseDouble(raw.trim());
            if (Double.isFinite(value) && Math.abs(value) <= limit) {
                return value;
            }
        } catch (NumberFormatException e) {
            log.trace("Ignoring non-numeric coordinate: {}", raw);
        }
        return null;
    }

    private static String firstNonBlank(Map<String, String> row, List<String> keys) {
        for (String key : keys) {
            String value = row.get(key);
            if (value != null && !value.isBlank()) {
                return value;
            }
        }
        return "";
    }
}
