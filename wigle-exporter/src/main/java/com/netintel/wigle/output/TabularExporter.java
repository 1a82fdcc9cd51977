package com.netintel.wigle.output;

import com.netintel.wigle.exception.ExportException;
import com.netintel.wigle.model.FlatRow;
import com.netintel.wigle.model.FlattenResult;
import com.opencsv.CSVWriter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Writes flattened rows to CSV.
 *
 * The header is the discovered column union in discovery order; rows missing a column get an
 * empty cell. Every value is quoted, embedded quotes doubled. A result with no rows produces
 * no file.
 */
@Component
@Slf4j
public class TabularExporter {

    public Optional<Path> export(FlattenResult result, Path destination) {
        return export(result.columns(), result.rows(), destination);
    }

    /**
     * @return the written file, or empty when there were no rows
     * @throws ExportException if the file could not be written; no partial file is left behind
     */
    public Optional<Path> export(List<String> columns, List<FlatRow> rows, Path destination) {
        if (rows.isEmpty()) {
            log.info("CSV export skipped, no rows: {}", destination);
            return Optional.empty();
        }

        String[] header = columns.toArray(new String[0]);
        try {
            AtomicFileWriter.write(destination, out -> {
                CSVWriter writer = new CSVWriter(out,
                        CSVWriter.DEFAULT_SEPARATOR,
                        CSVWriter.DEFAULT_QUOTE_CHARACTER,
                        CSVWriter.DEFAULT_ESCAPE_CHARACTER,
                        CSVWriter.DEFAULT_LINE_END);
                writer.writeNext(header);
                for (FlatRow row : rows) {
                    writer.writeNext(toRow(row, header));
                }
                writer.flush();
                if (writer.checkError()) {
                    throw new IOException("CSV writer reported an error");
                }
            });
        } catch (IOException e) {
            log.error("Failed to write CSV file {}: {}", destination, e.getMessage(), e);
            throw new ExportException("CSV write failed", destination, e);
        }

        log.info("Written {} rows x {} columns to CSV: {}", rows.size(), header.length, destination);
        return Optional.of(destination);
    }

    private String[] toRow(FlatRow row, String[] header) {
        String[] values = new String[header.length];
        for (int i = 0; i < header.length; i++) {
            values[i] = row.get(header[i]);
        }
        return values;
    }
}
