package com.netintel.wigle.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.netintel.wigle.exception.AuthorizationException;
import com.netintel.wigle.exception.WigleApiException;
import com.netintel.wigle.model.FlatRow;
import com.netintel.wigle.model.MccMncRecord;
import com.netintel.wigle.output.TabularExporter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Mobile network code lookup against the cell MCC/MNC endpoint.
 *
 * The service answers either a flat result list or a map keyed by MCC then MNC. When a
 * combined MCC+MNC query comes back empty the lookup retries with the concatenated
 * {@code mccmnc} form, MNC as given, then zero-padded to two and three digits. A failed
 * request moves on to the next form; the lookup fails only when no request got an answer.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class MccMncLookupService {

    private final WigleApiClient apiClient;
    private final TabularExporter tabularExporter;

    public List<MccMncRecord> lookup(String mcc, String mnc) {
        String cleanMcc = mcc == null ? "" : mcc.trim();
        String cleanMnc = mnc == null ? "" : mnc.trim();
        if (cleanMcc.isEmpty() && cleanMnc.isEmpty()) {
            throw new IllegalArgumentException("Enter at least an MCC or an MCC + MNC");
        }

        Map<String, String> primary = new LinkedHashMap<>();
        if (!cleanMcc.isEmpty()) {
            primary.put("mcc", cleanMcc);
            if (!cleanMnc.isEmpty()) {
                primary.put("mnc", cleanMnc);
            }
        }

        List<Map<String, String>> attempts = new ArrayList<>();
        attempts.add(primary);
        if (!cleanMcc.isEmpty() && !cleanMnc.isEmpty()) {
            combinedForms(cleanMcc, cleanMnc).forEach(combined -> attempts.add(Map.of("mccmnc", combined)));
        }

        List<MccMncRecord> records = List.of();
        WigleApiException lastFailure = null;
        boolean answered = false;
        for (Map<String, String> params : attempts) {
            if (params != primary) {
                log.info("MCC/MNC retry with {}", params);
            }
            try {
                records = query(params);
                answered = true;
            } catch (AuthorizationException e) {
                throw e;
            } catch (WigleApiException e) {
                log.warn("MCC/MNC request {} failed: {}", params, e.getMessage());
                lastFailure = e;
            }
            if (!records.isEmpty()) {
                break;
            }
        }
        if (!answered && lastFailure != null) {
            throw lastFailure;
        }
        log.info("MCC/MNC lookup mcc={} mnc={}: {} result(s)", cleanMcc, cleanMnc, records.size());
        return records;
    }

    /**
     * @return the written file, or empty when there was nothing to write
     */
    public Optional<Path> exportCsv(List<MccMncRecord> records, Path destination) {
        List<FlatRow> rows = records.stream().map(r -> new FlatRow(r.toRow())).toList();
        return tabularExporter.export(List.of(MccMncRecord.HEADERS), rows, destination);
    }

    private List<MccMncRecord> query(Map<String, String> params) {
        JsonNode body = apiClient.fetchMccMnc(params);
        return extract(body, params).stream().map(MccMncLookupService::toRecord).toList();
    }

    static Set<String> combinedForms(String mcc, String mnc) {
        Set<String> forms = new LinkedHashSet<>();
        forms.add(mcc + mnc);
        if (mnc.chars().allMatch(Character::isDigit)) {
            forms.add(mcc + leftPad(mnc, 2));
            forms.add(mcc + leftPad(mnc, 3));
        }
        return forms;
    }

    private static String leftPad(String digits, int width) {
        return digits.length() >= width ? digits : "0".repeat(width - digits.length()) + digits;
    }

    static List<JsonNode> extract(JsonNode body, Map<String, String> params) {
        List<JsonNode> records = new ArrayList<>();
        if (body == null) {
            return records;
        }
        if (body.isArray()) {
            body.forEach(n -> { if (n.isObject()) records.add(n); });
            return records;
        }
        if (!body.isObject()) {
            return records;
        }
        if (body.path("results").isArray()) {
            body.get("results").forEach(n -> { if (n.isObject()) records.add(n); });
            return records;
        }
        if (body.path("result").isObject()) {
            records.add(body.get("result"));
            return records;
        }

        String mcc = params.get("mcc");
        String mnc = params.get("mnc");
        if (mcc != null && mnc != null && body.path(mcc).path(mnc).isObject()) {
            records.add(body.get(mcc).get(mnc));
            return records;
        }
        // {mcc: {mnc: record}}
        for (Iterator<JsonNode> byMcc = body.elements(); byMcc.hasNext(); ) {
            JsonNode operators = byMcc.next();
            if (operators.isObject()) {
                operators.forEach(n -> { if (n.isObject()) records.add(n); });
            }
        }
        return records;
    }

    static MccMncRecord toRecord(JsonNode node) {
        String name = firstText(node, "countryName", "country");
        String code = firstText(node, "countryCode", "cc");
        String country = !name.isEmpty() && !code.isEmpty() ? name + " (" + code + ")" : name + code;
        return new MccMncRecord(country,
                node.path("brand").asText(""),
                node.path("operator").asText(""),
                node.path("bands").asText(""),
                node.path("notes").asText(""));
    }

    private static String firstText(JsonNode node, String... keys) {
        for (String key : keys) {
            String value = node.path(key).asText("");
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }
}
