package com.netintel.wigle.model;

import java.util.List;

/**
 * Column union in first-seen order, the rows that fill it, and the coordinate-bearing subset.
 */
public record FlattenResult(List<String> columns, List<FlatRow> rows, List<GeoPoint> points) {

    public FlattenResult {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
        points = List.copyOf(points);
    }

    public static FlattenResult empty() {
        return new FlattenResult(List.of(), List.of(), List.of());
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
