package com.netintel.wigle.model;

import java.util.Locale;

/**
 * Paginated search endpoints and the file prefix used for their run directories.
 */
public enum SearchKind {

    WIFI("/api/v2/network/search", "wifi-basic"),
    BLUETOOTH("/api/v2/bluetooth/search", "bt-basic"),
    CELL("/api/v2/cell/search", "cell-basic");

    private final String path;
    private final String label;

    SearchKind(String path, String label) {
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
     * Accepts the enum name or a short alias: wifi, bt, bluetooth, cell.
     */
    public static SearchKind parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Search kind is required");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "wifi", "network" -> WIFI;
            case "bt", "bluetooth" -> BLUETOOTH;
            case "cell" -> CELL;
            default -> throw new IllegalArgumentException("Unknown search kind: " + value);
        };
    }
}
