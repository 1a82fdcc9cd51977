package com.netintel.wigle.output;

import com.netintel.wigle.exception.ExportException;
import com.netintel.wigle.model.GeoPoint;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import javax.xml.stream.XMLOutputFactory;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamWriter;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Writes points as KML 2.2 placemarks.
 *
 * Each placemark carries every attribute of its source row under ExtendedData, so the
 * KML loses nothing the CSV has for that row. No points, no file.
 */
@Component
@Slf4j
public class GeoExporter {

    static final String KML_NS = "http://www.opengis.net/kml/2.2";

    private final XMLOutputFactory outputFactory = XMLOutputFactory.newFactory();

    /**
     * @param documentName shown as the KML document name
     * @return the written file, or empty when there were no points
     * @throws ExportException if the file could not be written; no partial file is left behind
     */
    public Optional<Path> export(List<GeoPoint> points, String documentName, Path destination) {
        if (points.isEmpty()) {
            log.info("KML export skipped, no points with lat/lon: {}", destination);
            return Optional.empty();
        }

        try {
            AtomicFileWriter.write(destination, out -> {
                try {
                    XMLStreamWriter xml = outputFactory.createXMLStreamWriter(out);
                    writeDocument(xml, points, documentName);
                    xml.flush();
                    xml.close();
                } catch (XMLStreamException e) {
                    throw new IOException("KML serialisation failed: " + e.getMessage(), e);
                }
            });
        } catch (IOException e) {
            log.error("Failed to write KML file {}: {}", destination, e.getMessage(), e);
            throw new ExportException("KML write failed", destination, e);
        }

        log.info("Written {} placemarks to KML: {}", points.size(), destination);
        return Optional.of(destination);
    }

    private void writeDocument(XMLStreamWriter xml, List<GeoPoint> points, String documentName)
            throws XMLStreamException {
        xml.writeStartDocument("UTF-8", "1.0");
        xml.writeStartElement("kml");
        xml.writeDefaultNamespace(KML_NS);
        xml.writeStartElement("Document");
        textElement(xml, "name", documentName);

        for (GeoPoint point : points) {
            xml.writeStartElement("Placemark");
            textElement(xml, "name", point.name());

            xml.writeStartElement("ExtendedData");
            for (Map.Entry<String, String> attr : point.attributes().entrySet()) {
                xml.writeStartElement("Data");
                xml.writeAttribute("name", clean(attr.getKey()));
                textElement(xml, "value", attr.getValue());
                xml.writeEndElement();
            }
            xml.writeEndElement();

            xml.writeStartElement("Point");
            textElement(xml, "coordinates",
                    format(point.longitude()) + "," + format(point.latitude()) + ",0");
            xml.writeEndElement();

            xml.writeEndElement();
        }

        xml.writeEndElement();
        xml.writeEndElement();
        xml.writeEndDocument();
    }

    private void textElement(XMLStreamWriter xml, String name, String text) throws XMLStreamException {
        xml.writeStartElement(name);
        xml.writeCharacters(clean(text));
        xml.writeEndElement();
    }

    private static String format(double coordinate) {
        return BigDecimal.valueOf(coordinate).stripTrailingZeros().toPlainString();
    }

    /**
     * Drops characters that XML 1.0 cannot carry at all (control characters other than tab/CR/LF).
     */
    static String clean(String text) {
        if (text == null) return "";
        StringBuilder sb = null;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean legal = c == 0x9 || c == 0xA || c == 0xD || (c >= 0x20 && c <= 0xD7FF)
                    || Character.isSurrogate(c) || (c >= 0xE000 && c <= 0xFFFD);
            if (!legal) {
                if (sb == null) {
                    sb = new StringBuilder(text.length());
                    sb.append(text, 0, i);
                }
            } else if (sb != null) {
                sb.append(c);
            }
        }
        return sb == null ? text : sb.toString();
    }
}
