package com.netintel.wigle.output;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes a file through a sibling ".part" file and renames it into place, so a failed
 * write never leaves a truncated artifact under the final name.
 */
@Slf4j
final class AtomicFileWriter {

    @FunctionalInterface
    interface Body {
        void writeTo(Writer writer) throws IOException;
    }

    private AtomicFileWriter() {
    }

    static void write(Path destination, Body body) throws IOException {
        Files.createDirectories(destination.toAbsolutePath().getParent());
        Path part = destination.resolveSibling(destination.getFileName() + ".part");
        try {
            try (Writer writer = Files.newBufferedWriter(part, StandardCharsets.UTF_8)) {
                body.writeTo(writer);
            }
            moveIntoPlace(part, destination);
        } catch (IOException | RuntimeException e) {
            deleteQuietly(part);
            throw e;
        }
    }

    private static void moveIntoPlace(Path part, Path destination) throws IOException {
        try {
            Files.move(part, destination, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", destination);
            Files.move(part, destination, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path part) {
        try {
            Files.deleteIfExists(part);
        } catch (IOException e) {
            log.warn("Could not remove partial file {}: {}", part, e.getMessage());
        }
    }
}
