package com.netintel.wigle.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * The parts of a search response the fetcher depends on.
 */
public record SearchResponse(List<JsonNode> records, String nextCursor, Long totalResults) {

    public SearchResponse {
        records = List.copyOf(records);
    }

    public boolean hasCursor() {
        return nextCursor != null && !nextCursor.isBlank();
    }
}
