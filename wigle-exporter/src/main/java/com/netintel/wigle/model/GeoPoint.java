package com.netintel.wigle.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A coordinate plus every attribute of the row it came from, in row order.
 */
public record GeoPoint(double latitude, double longitude, String name, Map<String, String> attributes) {

    public GeoPoint {
        attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        name = name == null ? "" : name;
    }
}
