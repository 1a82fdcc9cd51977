package com.netintel.wigle.output;

import com.netintel.wigle.model.GeoPoint;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NodeList;

import javax.xml.parsers.DocumentBuilderFactory;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

class GeoExporterTest {

    @TempDir
    Path tempDir;

    private final GeoExporter exporter = new GeoExporter();

    private static Document parse(Path kml) throws Exception {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        return factory.newDocumentBuilder().parse(kml.toFile());
    }

    private static NodeList byName(Document doc, String local) {
        return doc.getElementsByTagNameNS(GeoExporter.KML_NS, local);
    }

    private static GeoPoint point(double lat, double lon, String name, String... keyValues) {
        Map<String, String> attributes = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            attributes.put(keyValues[i], keyValues[i + 1]);
        }
        return new GeoPoint(lat, lon, name, attributes);
    }

    @Test
    void shouldWriteOnePlacemarkPerPointWithAllAttributes() throws Exception {
        // Given
        List<GeoPoint> points = List.of(
                point(40.1, -75.25, "home", "netid", "AA:BB", "channel", "6"),
                point(51.5, 0.0, "cafe", "netid", "CC:DD", "channel", ""));
        Path dest = tempDir.resolve("bundle.kml");

        // When
        Optional<Path> written = exporter.export(points, "bundle", dest);

        // Then
        assertThat(written).contains(dest);
        Document doc = parse(dest);
        assertThat(byName(doc, "Placemark").getLength()).isEqualTo(2);

        Element first = (Element) byName(doc, "Placemark").item(0);
        assertThat(first.getElementsByTagNameNS(GeoExporter.KML_NS, "name").item(0).getTextContent()).isEqualTo("home");
        NodeList data = first.getElementsByTagNameNS(GeoExporter.KML_NS, "Data");
        assertThat(data.getLength()).isEqualTo(2);
        assertThat(((Element) data.item(0)).getAttribute("name")).isEqualTo("netid");
        assertThat(data.item(0).getTextContent()).isEqualTo("AA:BB");
        assertThat(first.getElementsByTagNameNS(GeoExporter.KML_NS, "coordinates").item(0).getTextContent())
                .isEqualTo("-75.25,40.1,0");

        Element second = (Element) byName(doc, "Placemark").item(1);
        assertThat(second.getElementsByTagNameNS(GeoExporter.KML_NS, "coordinates").item(0).getTextContent())
                .isEqualTo("0,51.5,0");
    }

    @Test
    void shouldEscapeMarkupAndDropIllegalControlCharacters() throws Exception {
        // Given
        List<GeoPoint> points = List.of(point(1, 2, "<b>Tom & Jerry</b>", "ssid", "a\u0001b \"q\""));
        Path dest = tempDir.resolve("escaped.kml");

        // When
        exporter.export(points, "escaped", dest);

        // Then
        Document doc = parse(dest);
        Element placemark = (Element) byName(doc, "Placemark").item(0);
        assertThat(placemark.getElementsByTagNameNS(GeoExporter.KML_NS, "name").item(0).getTextContent())
                .isEqualTo("<b>Tom & Jerry</b>");
        assertThat(placemark.getElementsByTagNameNS(GeoExporter.KML_NS, "value").item(0).getTextContent())
                .isEqualTo("ab \"q\"");
        assertThat(Files.readString(dest)).contains("&lt;b").contains("Tom &amp; Jerry");
    }

    @Test
    void shouldNotCreateFileWithoutPoints() {
        // Given
        Path dest = tempDir.resolve("none.kml");

        // When
        Optional<Path> written = exporter.export(List.of(), "none", dest);

        // Then
        assertThat(written).isEmpty();
        assertThat(dest).doesNotExist();
    }

    @Test
    void shouldNameDocumentAfterBundle() throws Exception {
        // Given
        Path dest = tempDir.resolve("named.kml");

        // When
        exporter.export(List.of(point(1, 1, "x")), "wifi-basic-1700000000", dest);

        // Then
        Element document = (Element) byName(parse(dest), "Document").item(0);
        Element name = (Element) document.getElementsByTagNameNS(GeoExporter.KML_NS, "name").item(0);
        assertThat(name.getTextContent()).isEqualTo("wifi-basic-1700000000");
    }
}
