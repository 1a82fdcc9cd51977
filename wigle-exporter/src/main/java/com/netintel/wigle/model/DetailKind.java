package com.netintel.wigle.model;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Single-identifier detail endpoints. Wi-Fi and cell share the network endpoint.
 */
public enum DetailKind {

    NETWORK("/api/v2/network/detail", "wifi-detail"),
    BLUETOOTH("/api/v2/bluetooth/detail", "bt-detail");

    // Cell ids as shown in cell search results: OPERATOR_LAC_CID
    private static final Pattern CELL_ID = Pattern.compile("^(\\d+)_(\\d+)_(\\d+)$");

    private final String path;
    private final String label;

    DetailKind(String path, String label) {
        this.path = path;
        this.label = label;
    }

    public String path() {
        return path;
    }

    public String label() {
        return label;
    }

    /**
     * Request parameters that address one identifier on this endpoint.
     * A cell id of the form OP_LAC_CID expands to operator/lac/cid; anything else is a netid.
     */
    public Map<String, String> identifierParams(String identifier) {
        Map<String, String> params = new LinkedHashMap<>();
        String id = identifier.trim();
        Matcher cell = CELL_ID.matcher(id);
        if (this == NETWORK && cell.matches()) {
            params.put("operator", cell.group(1));
            params.put("lac", cell.group(2));
            params.put("cid", cell.group(3));
        } else {
            params.put("netid", id);
        }
        return params;
    }

    public static DetailKind parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Detail kind is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "wifi", "cell", "network" -> NETWORK;
            case "bt", "bluetooth" -> BLUETOOTH;
            default -> throw new IllegalArgumentException("Unknown detail kind: " + value);
        };
    }
}
