package com.netintel.wigle.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "wigle-exporter")
@Data
public class WigleExporterProperties {

    private Api api = new Api();
    private Credentials credentials = new Credentials();
    private Output output = new Output();
    private Fetch fetch = new Fetch();
    private Flatten flatten = new Flatten();

    @Data
    public static class Api {
        private String baseUrl = "https://api.wigle.net";
        private String userAgent = "WiGLE-Exporter/1.0 (+local)";
        private int connectTimeoutMs = 10_000;
        private int readTimeoutMs = 60_000;
        private long rateLimitDelayMs = 0;
    }

    @Data
    public static class Credentials {
        private String apiName;
        private String apiToken;
    }

    @Data
    public static class Output {
        private String outputDir = "./exports";
        private boolean csv = true;
        private boolean kml = true;
        private boolean retainPages = false;
    }

    @Data
    public static class Fetch {
        private int resultsPerPage = 100;
        /** 0 means no limit. */
        private int maxPages = 0;
        private boolean precheckTotal = true;
    }

    @Data
    public static class Flatten {
        private String separator = ".";
        private String listDelimiter = ";";
        private List<String> expansionKeys = new ArrayList<>(List.of("locationData", "locations"));
        private List<String> latitudeKeys = new ArrayList<>(List.of("trilat", "lat", "latitude"));
        private List<String> longitudeKeys = new ArrayList<>(List.of("trilong", "lon", "longitude"));
        private List<String> nameKeys = new ArrayList<>(List.of("ssid", "name", "netid", "id"));
    }
}
