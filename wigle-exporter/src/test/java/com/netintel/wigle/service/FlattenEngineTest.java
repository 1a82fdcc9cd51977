package com.netintel.wigle.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.netintel.wigle.config.WigleExporterProperties;
import com.netintel.wigle.model.FlatRow;
import com.netintel.wigle.model.FlattenResult;
import com.netintel.wigle.model.GeoPoint;
import com.netintel.wigle.model.Page;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FlattenEngineTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private FlattenEngine engine;

    @BeforeEach
    void setUp() {
        engine = new FlattenEngine(new WigleExporterProperties());
    }

    private JsonNode json(String text) throws Exception {
        return mapper.readTree(text);
    }

    private Page page(int number, String... records) throws Exception {
        List<JsonNode> nodes = new ArrayList<>();
        for (String record : records) {
            nodes.add(json(record));
        }
        return new Page(number, nodes, null, null);
    }

    @Nested
    @DisplayName("column union")
    class ColumnUnion {

        @Test
        void shouldOrderColumnsByFirstOccurrenceAcrossPages() throws Exception {
            // Given
            Page first = page(1, "{\"netid\":\"aa\",\"ssid\":\"home\"}");
            Page second = page(2, "{\"netid\":\"bb\",\"channel\":6,\"ssid\":\"cafe\"}");

            // When
            FlattenResult result = engine.flatten(List.of(first, second));

            // Then
            assertThat(result.columns()).containsExactly("netid", "ssid", "channel");
            assertThat(result.rows()).hasSize(2);
            assertThat(result.rows().get(0).get("channel")).isEmpty();
            assertThat(result.rows().get(1).get("channel")).isEqualTo("6");
        }

        @Test
        void shouldProduceSameColumnSetWhateverTheRecordOrder() throws Exception {
            // Given
            String a = "{\"netid\":\"aa\",\"qos\":1}";
            String b = "{\"netid\":\"bb\",\"encryption\":\"wpa2\"}";

            // When
            FlattenResult ab = engine.flatten(List.of(page(1, a, b)));
            FlattenResult ba = engine.flatten(List.of(page(1, b, a)));

            // Then
            assertThat(ab.columns()).containsExactlyInAnyOrderElementsOf(ba.columns());
            assertThat(ab.columns()).containsExactly("netid", "qos", "encryption");
            assertThat(ba.columns()).containsExactly("netid", "encryption", "qos");
        }

        @Test
        void shouldReturnEmptyResultForNoPages() {
            // When
            FlattenResult result = engine.flatten(List.of());

            // Then
            assertThat(result.isEmpty()).isTrue();
            assertThat(result.columns()).isEmpty();
            assertThat(result.points()).isEmpty();
        }
    }

    @Nested
    @DisplayName("value rendering")
    class ValueRendering {

        @Test
        void shouldJoinNestedObjectKeysWithSeparator() throws Exception {
            // When
            List<FlatRow> rows = engine.rowsOf(json("{\"netid\":\"aa\",\"meta\":{\"source\":{\"app\":\"x\"},\"v\":2}}"));

            // Then
            assertThat(rows).hasSize(1);
            assertThat(rows.get(0).values())
                    .containsEntry("meta.source.app", "x")
                    .containsEntry("meta.v", "2")
                    .doesNotContainKey("meta");
        }

        @Test
        void shouldJoinScalarListsWithDelimiter() throws Exception {
            // When
            FlatRow row = engine.rowsOf(json("{\"freqs\":[2412,5180],\"tags\":[\"a\",null,\"c\"],\"none\":[]}")).get(0);

            // Then
            assertThat(row.get("freqs")).isEqualTo("2412;5180");
            assertThat(row.get("tags")).isEqualTo("a;;c");
            assertThat(row.get("none")).isEmpty();
        }

        @Test
        void shouldRenderNullAndEmptyObjectAsEmptyString() throws Exception {
            // When
            FlatRow row = engine.rowsOf(json("{\"ssid\":null,\"extra\":{}}")).get(0);

            // Then
            assertThat(row.values()).containsEntry("ssid", "").containsEntry("extra", "");
        }

        @Test
        void shouldKeepMixedArraysAsJsonText() throws Exception {
            // When
            FlatRow row = engine.rowsOf(json("{\"netid\":\"aa\",\"mixed\":[1,{\"k\":\"v\"}]}")).get(0);

            // Then
            assertThat(row.get("mixed")).isEqualTo("[1,{\"k\":\"v\"}]");
        }

        @Test
        void shouldPutScalarRecordsUnderValueColumn() throws Exception {
            // When
            FlattenResult result = engine.flatten(List.of(page(1, "\"just text\"")));

            // Then
            assertThat(result.columns()).containsExactly("value");
            assertThat(result.rows().get(0).get("value")).isEqualTo("just text");
        }
    }

    @Nested
    @DisplayName("location expansion")
    class Expansion {

        @Test
        void shouldExpandLocationDataIntoOneRowPerItem() throws Exception {
            // Given
            String record = "{\"netid\":\"AA:BB\",\"ssid\":\"home\",\"locationData\":["
                    + "{\"latitude\":51.5,\"longitude\":-0.12,\"signal\":-70},"
                    + "{\"latitude\":51.6,\"longitude\":-0.13,\"signal\":-80}]}";

            // When
            FlattenResult result = engine.flatten(List.of(page(1, record)));

            // Then
            assertThat(result.rows()).hasSize(2);
            assertThat(result.columns()).containsExactly("netid", "ssid", "latitude", "longitude", "signal");
            assertThat(result.rows().get(1).get("netid")).isEqualTo("AA:BB");
            assertThat(result.rows().get(1).get("signal")).isEqualTo("-80");
            assertThat(result.points()).hasSize(2);
            assertThat(result.points().get(0).name()).isEqualTo("home");
        }

        @Test
        void shouldKeepRecordAsSingleRowWhenLocationListIsEmpty() throws Exception {
            // When
            List<FlatRow> rows = engine.rowsOf(json("{\"netid\":\"aa\",\"locationData\":[]}"));

            // Then
            assertThat(rows).hasSize(1);
            assertThat(rows.get(0).get("locationData")).isEmpty();
        }

        @Test
        void shouldLetItemFieldsWinOnCollision() throws Exception {
            // When
            FlatRow row = engine.rowsOf(json("{\"trilat\":10.0,\"trilong\":20.0,\"locations\":[{\"trilat\":11.5}]}")).get(0);

            // Then
            assertThat(row.get("trilat")).isEqualTo("11.5");
            assertThat(row.get("trilong")).isEqualTo("20.0");
        }

        @Test
        void shouldExpandFirstArrayOfObjectsWhenNoConfiguredKeyPresent() throws Exception {
            // When
            List<FlatRow> rows = engine.rowsOf(json("{\"id\":\"x\",\"obs\":[{\"a\":1},{\"a\":2}],\"other\":[{\"b\":1}]}"));

            // Then
            assertThat(rows).hasSize(2);
            assertThat(rows.get(0).get("a")).isEqualTo("1");
            assertThat(rows.get(0).get("other")).isEqualTo("[{\"b\":1}]");
        }
    }

    @Nested
    @DisplayName("coordinates")
    class Coordinates {

        @Test
        void shouldSkipRowsWithoutUsableCoordinates() throws Exception {
            // Given
            Page records = page(1,
                    "{\"netid\":\"a\",\"trilat\":40.1,\"trilong\":-75.2}",
                    "{\"netid\":\"b\"}",
                    "{\"netid\":\"c\",\"trilat\":\"n/a\",\"trilong\":1}",
                    "{\"netid\":\"d\",\"trilat\":95.0,\"trilong\":1}");

            // When
            FlattenResult result = engine.flatten(List.of(records));

            // Then
            assertThat(result.rows()).hasSize(4);
            assertThat(result.points()).hasSize(1);
            GeoPoint point = result.points().get(0);
            assertThat(point.latitude()).isEqualTo(40.1);
            assertThat(point.longitude()).isEqualTo(-75.2);
            assertThat(point.name()).isEqualTo("a");
            assertThat(point.attributes()).containsKeys("netid", "trilat", "trilong");
        }

        @Test
        void shouldFallBackToAlternativeCoordinateKeys() throws Exception {
            // When
            FlattenResult result = engine.flatten(List.of(page(1, "{\"name\":\"tower\",\"lat\":1.5,\"lon\":2.5}")));

            // Then
            assertThat(result.points()).singleElement()
                    .satisfies(p -> {
                        assertThat(p.latitude()).isEqualTo(1.5);
                        assertThat(p.longitude()).isEqualTo(2.5);
                        assertThat(p.name()).isEqualTo("tower");
                    });
        }
    }
}
