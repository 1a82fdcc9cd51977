package com.netintel.wigle.model;

import java.util.LinkedHashMap;
import java.util.Map;

public record MccMncRecord(String country, String brand, String operator, String bands, String notes) {

    public static final String[] HEADERS = {"Country", "Brand", "Operator", "Bands", "Notes"};

    public Map<String, String> toRow() {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(HEADERS[0], country);
        row.put(HEADERS[1], brand);
        row.put(HEADERS[2], operator);
        row.put(HEADERS[3], bands);
        row.put(HEADERS[4], notes);
        return row;
    }
}
