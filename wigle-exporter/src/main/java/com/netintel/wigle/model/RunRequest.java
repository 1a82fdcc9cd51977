package com.netintel.wigle.model;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Body of a run trigger. Every field is optional; unset switches fall back to configuration.
 */
@Data
public class RunRequest {

    /** Query filters passed to the endpoint as-is (ssid, latrange1, netid, ...). */
    private Map<String, String> params = new LinkedHashMap<>();

    private Boolean csv;
    private Boolean kml;
    private Boolean retainPages;

    @Min(value = 1, message = "resultsPerPage must be at least 1")
    @Max(value = 1000, message = "resultsPerPage must be at most 1000")
    private Integer resultsPerPage;

    @Min(value = 0, message = "maxPages must be 0 (no limit) or positive")
    private Integer maxPages;

    // batch only
    private List<String> identifiers = new ArrayList<>();
    private String identifiersFile;
}
