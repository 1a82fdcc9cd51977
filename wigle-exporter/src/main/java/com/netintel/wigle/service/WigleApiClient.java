package com.netintel.wigle.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.netintel.wigle.config.WigleExporterProperties;
import com.netintel.wigle.exception.AuthorizationException;
import com.netintel.wigle.exception.NotFoundException;
import com.netintel.wigle.exception.TransientFetchException;
import com.netintel.wigle.exception.WigleApiException;
import com.netintel.wigle.model.DetailKind;
import com.netintel.wigle.model.SearchKind;
import com.netintel.wigle.model.SearchResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Thin client over the WiGLE v2 REST API.
 *
 * Every HTTP failure is translated into the exception taxonomy the pipeline acts on:
 * 401/403 → AuthorizationException, 404 → NotFoundException, 429/5xx/timeouts →
 * TransientFetchException, any other status → WigleApiException. Retrying is left
 * to the caller.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class WigleApiClient {

    static final String MCC_MNC_PATH = "/api/v2/cell/mccMnc";
    /** Owned by the client; caller filters carrying these keys are ignored. */
    static final Set<String> PAGINATION_PARAMS = Set.of("searchAfter", "search_after", "resultsPerPage");
    private static final int ERROR_BODY_LIMIT = 400;

    private final RestTemplate restTemplate;
    private final WigleExporterProperties properties;

    /**
     * Fetch one search page.
     *
     * @param params         caller filters, without pagination fields
     * @param cursor         continuation cursor from the previous page, null on the first call
     * @param resultsPerPage page size hint
     */
    public SearchResponse search(SearchKind kind, Map<String, String> params, String cursor, int resultsPerPage) {
        JsonNode body = callApi(searchUri(kind, params, cursor, resultsPerPage));
        failIfUnsuccessful(body, false);

        List<JsonNode> records = new ArrayList<>();
        JsonNode results = body.path("results");
        if (results.isArray()) {
            results.forEach(records::add);
        }
        return new SearchResponse(records, extractCursor(body), extractTotal(body));
    }

    /**
     * Ask for a single result to learn the total match count. Informational only:
     * failures other than authorization are logged and yield null.
     */
    public Long fetchTotalCount(SearchKind kind, Map<String, String> params) {
        try {
            return search(kind, params, null, 1).totalResults();
        } catch (AuthorizationException e) {
            throw e;
        } catch (WigleApiException e) {
            log.warn("Count check failed for {}: {}", kind, e.getMessage());
            return null;
        }
    }

    /**
     * Fetch the records for one identifier.
     *
     * @return the detail records, never empty
     * @throws NotFoundException when the service knows nothing about the identifier
     */
    public List<JsonNode> fetchDetail(DetailKind kind, Map<String, String> params) {
        JsonNode body = callApi(detailUri(kind, params));
        failIfUnsuccessful(body, true);

        List<JsonNode> records = new ArrayList<>();
        JsonNode results = body.path("results");
        if (results.isArray()) {
            results.forEach(records::add);
        }
        if (records.isEmpty() && body.path("result").isObject()) {
            records.add(body.get("result"));
        }
        if (records.isEmpty()) {
            throw new NotFoundException("No results for " + params);
        }
        return records;
    }

    /**
     * Raw MCC/MNC lookup response; its shape varies with the query.
     */
    public JsonNode fetchMccMnc(Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl() + MCC_MNC_PATH);
        params.forEach(builder::queryParam);
        return callApi(builder.build().encode().toUri());
    }

    public URI searchUri(SearchKind kind, Map<String, String> params, String cursor, int resultsPerPage) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl() + kind.path());
        params.forEach((k, v) -> {
            if (!PAGINATION_PARAMS.contains(k) && v != null && !v.isBlank()) {
                builder.queryParam(k, v.trim());
            }
        });
        builder.queryParam("resultsPerPage", resultsPerPage);
        if (cursor != null) {
            builder.queryParam("searchAfter", cursor);
        }
        return builder.build().encode().toUri();
    }

    public URI detailUri(DetailKind kind, Map<String, String> params) {
        UriComponentsBuilder builder = UriComponentsBuilder.fromHttpUrl(baseUrl() + kind.path());
        params.forEach(builder::queryParam);
        return builder.build().encode().toUri();
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private JsonNode callApi(URI uri) {
        log.debug("Calling WiGLE API: {}", uri);
        applyRateLimit();
        try {
            JsonNode body = restTemplate.getForObject(uri, JsonNode.class);
            if (body == null) {
                throw new WigleApiException("Empty response body from " + uri.getPath());
            }
            return body;

        } catch (HttpStatusCodeException e) {
            throw translate(e, uri);

        } catch (ResourceAccessException e) {
            // connect/read timeouts and broken connections
            throw new TransientFetchException("I/O error calling " + uri.getPath() + ": " + e.getMessage(), 0, e);

        } catch (RestClientException e) {
            throw new WigleApiException("Unreadable response from " + uri.getPath() + ": " + e.getMessage(), e);
        }
    }

    private WigleApiException translate(HttpStatusCodeException e, URI uri) {
        int status = e.getStatusCode().value();
        String detail = "HTTP " + status + " from " + uri.getPath() + bodySnippet(e);

        if (status == 401 || status == 403) {
            log.error("WiGLE rejected the credentials: {}", detail);
            return new AuthorizationException("Authorization failed: " + detail, status, e);
        }
        if (status == 404) {
            return new NotFoundException("Not found: " + detail, e);
        }
        if (status == 429 || status >= 500) {
            log.warn("Transient WiGLE failure: {}", detail);
            return new TransientFetchException(detail, status, e);
        }
        log.error("WiGLE call failed: {}", detail);
        return new WigleApiException(detail, status, e);
    }

    /**
     * WiGLE reports some failures as 200 with success=false and a message.
     */
    private void failIfUnsuccessful(JsonNode body, boolean detail) {
        JsonNode success = body.get("success");
        if (success == null || !success.isBoolean() || success.asBoolean()) {
            return;
        }
        String message = body.path("message").asText("request unsuccessful");
        if (detail) {
            throw new NotFoundException(message);
        }
        throw new WigleApiException(message);
    }

    private String extractCursor(JsonNode body) {
        JsonNode node = body.get("searchAfter");
        if (node == null || node.isNull()) {
            node = body.get("search_after");
        }
        if (node == null || node.isNull()) {
            return null;
        }
        String text = node.isValueNode() ? node.asText() : node.toString();
        return text.isBlank() ? null : text;
    }

    private Long extractTotal(JsonNode body) {
        JsonNode node = body.get("totalResults");
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.canConvertToLong()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private String bodySnippet(HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        if (body == null || body.isBlank()) {
            return "";
        }
        return " – " + (body.length() > ERROR_BODY_LIMIT ? body.substring(0, ERROR_BODY_LIMIT) : body);
    }

    private String baseUrl() {
        String base = properties.getApi().getBaseUrl();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private void applyRateLimit() {
        long delay = properties.getApi().getRateLimitDelayMs();
        if (delay <= 0) return;
        try {
            Thread.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }
}
