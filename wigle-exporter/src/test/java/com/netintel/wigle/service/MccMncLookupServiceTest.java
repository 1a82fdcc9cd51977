package com.netintel.wigle.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.netintel.wigle.exception.AuthorizationException;
import com.netintel.wigle.exception.TransientFetchException;
import com.netintel.wigle.exception.WigleApiException;
import com.netintel.wigle.model.MccMncRecord;
import com.netintel.wigle.output.TabularExporter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class MccMncLookupServiceTest {

    @TempDir
    Path tempDir;

    @Mock
    private WigleApiClient apiClient;

    private final ObjectMapper mapper = new ObjectMapper();
    private MccMncLookupService service;

    @BeforeEach
    void setUp() {
        service = new MccMncLookupService(apiClient, new TabularExporter());
    }

    @Test
    void shouldReadNestedMccMncMap() throws Exception {
        // Given
        when(apiClient.fetchMccMnc(Map.of("mcc", "310", "mnc", "410"))).thenReturn(mapper.readTree(
                "{\"310\":{\"410\":{\"countryName\":\"United States\",\"countryCode\":\"US\","
                        + "\"brand\":\"AT&T\",\"operator\":\"AT&T Mobility\",\"bands\":\"GSM 850\",\"notes\":\"\"}}}"));

        // When
        List<MccMncRecord> records = service.lookup("310", "410");

        // Then
        assertThat(records).containsExactly(
                new MccMncRecord("United States (US)", "AT&T", "AT&T Mobility", "GSM 850", ""));
    }

    @Test
    void shouldReadResultsListForMccOnlyQuery() throws Exception {
        // Given
        when(apiClient.fetchMccMnc(Map.of("mcc", "234"))).thenReturn(mapper.readTree(
                "{\"results\":[{\"country\":\"United Kingdom\",\"brand\":\"O2\"},{\"cc\":\"GB\",\"brand\":\"EE\"},7]}"));

        // When
        List<MccMncRecord> records = service.lookup("234", "");

        // Then
        assertThat(records).extracting(MccMncRecord::country).containsExactly("United Kingdom", "GB");
        assertThat(records).extracting(MccMncRecord::brand).containsExactly("O2", "EE");
    }

    @Test
    void shouldRetryWithCombinedFormsWhenPrimaryQueryIsEmpty() throws Exception {
        // Given
        when(apiClient.fetchMccMnc(Map.of("mcc", "310", "mnc", "4"))).thenReturn(mapper.readTree("{}"));
        when(apiClient.fetchMccMnc(Map.of("mccmnc", "3104"))).thenThrow(new WigleApiException("HTTP 400", 400, null));
        when(apiClient.fetchMccMnc(Map.of("mccmnc", "31004"))).thenReturn(mapper.readTree("{\"results\":[]}"));
        when(apiClient.fetchMccMnc(Map.of("mccmnc", "310004"))).thenReturn(mapper.readTree(
                "{\"result\":{\"countryName\":\"United States\",\"brand\":\"Test\"}}"));

        // When
        List<MccMncRecord> records = service.lookup("310", "4");

        // Then
        assertThat(records).extracting(MccMncRecord::brand).containsExactly("Test");
        verify(apiClient).fetchMccMnc(Map.of("mccmnc", "310004"));
    }

    @Test
    void shouldUseCombinedFormWhenPrimaryRequestFails() throws Exception {
        // Given
        when(apiClient.fetchMccMnc(Map.of("mcc", "310", "mnc", "ab")))
                .thenThrow(new TransientFetchException("HTTP 503", 503, null));
        when(apiClient.fetchMccMnc(Map.of("mccmnc", "310ab"))).thenReturn(mapper.readTree(
                "[{\"countryName\":\"United States\",\"brand\":\"Fallback\"}]"));

        // When
        List<MccMncRecord> records = service.lookup("310", "ab");

        // Then
        assertThat(records).extracting(MccMncRecord::brand).containsExactly("Fallback");
    }

    @Test
    void shouldFailWhenNoRequestIsAnswered() {
        // Given
        when(apiClient.fetchMccMnc(anyMap())).thenThrow(new TransientFetchException("HTTP 502", 502, null));

        // When / Then
        assertThatThrownBy(() -> service.lookup("310", "410"))
                .isInstanceOf(WigleApiException.class)
                .hasMessage("HTTP 502");
        verify(apiClient).fetchMccMnc(Map.of("mcc", "310", "mnc", "410"));
        verify(apiClient).fetchMccMnc(Map.of("mccmnc", "310410"));
        verify(apiClient, times(2)).fetchMccMnc(anyMap());
    }

    @Test
    void shouldReturnEmptyWhenServiceAnswersWithNothing() throws Exception {
        // Given
        when(apiClient.fetchMccMnc(Map.of("mcc", "999"))).thenReturn(mapper.readTree("{\"results\":[]}"));

        // When / Then
        assertThat(service.lookup("999", null)).isEmpty();
    }

    @Test
    void shouldPropagateAuthorizationFailure() {
        // Given
        when(apiClient.fetchMccMnc(Map.of("mcc", "310")))
                .thenThrow(new AuthorizationException("HTTP 401", 401, null));

        // When / Then
        assertThatThrownBy(() -> service.lookup("310", null)).isInstanceOf(AuthorizationException.class);
    }

    @Test
    void shouldRejectEmptyQuery() {
        assertThatThrownBy(() -> service.lookup(" ", null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void shouldSkipPaddedFormsForNonNumericMnc() {
        assertThat(MccMncLookupService.combinedForms("310", "ab")).containsExactly("310ab");
        assertThat(MccMncLookupService.combinedForms("310", "410")).containsExactly("310410");
    }

    @Test
    void shouldExportRecordsWithFixedHeader() throws Exception {
        // Given
        List<MccMncRecord> records = List.of(new MccMncRecord("Canada (CA)", "Rogers", "Rogers Wireless", "LTE", "x"));
        Path dest = tempDir.resolve("mccmnc.csv");

        // When
        Optional<Path> written = service.exportCsv(records, dest);

        // Then
        assertThat(written).contains(dest);
        List<String> lines = Files.readAllLines(dest, StandardCharsets.UTF_8);
        assertThat(lines.get(0)).isEqualTo("\"Country\",\"Brand\",\"Operator\",\"Bands\",\"Notes\"");
        assertThat(lines.get(1)).isEqualTo("\"Canada (CA)\",\"Rogers\",\"Rogers Wireless\",\"LTE\",\"x\"");
    }
}
