package com.netintel.wigle.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Single-level view of one record, or of one expanded item within a record.
 */
public record FlatRow(Map<String, String> values) {

    public FlatRow {
        values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    /** Value for a column, or an empty string when this row never saw the key. */
    public String get(String column) {
        return values.getOrDefault(column, "");
    }
}
