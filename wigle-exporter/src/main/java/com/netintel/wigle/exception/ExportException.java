package com.netintel.wigle.exception;

import java.nio.file.Path;

/**
 * A single output artifact (page file, CSV, KML) or the output directory could not be written.
 */
public class ExportException extends RuntimeException {

    private final Path path;

    public ExportException(String message, Path path, Throwable cause) {
        super(message + ": " + path, cause);
        this.path = path;
    }

    public Path getPath() {
        return path;
    }
}
