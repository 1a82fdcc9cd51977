package com.netintel.wigle.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * One fetched page. Numbered from 1 in fetch order; cursor and total may be null.
 */
public record Page(int number, List<JsonNode> records, String cursor, Long totalResults) {

    public Page {
        records = List.copyOf(records);
    }

    public int size() {
        return records.size();
    }
}
