package com.netintel.wigle.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.netintel.wigle.exception.ExportException;
import com.netintel.wigle.model.BundleLocation;
import com.netintel.wigle.model.Page;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Append-only store of the raw pages of one run.
 *
 * Each page is written to {baseName}-page_{n}.json (a compact JSON array of that page's
 * records) before the fetcher asks for the next one. Owned by a single run; not thread-safe.
 */
@Slf4j
public class PageStore {

    private final ObjectMapper objectMapper;
    private final BundleLocation location;
    private final List<Page> pages = new ArrayList<>();
    private final List<Path> pageFiles = new ArrayList<>();
    private boolean finished;

    public PageStore(ObjectMapper objectMapper, BundleLocation location) {
        this.objectMapper = objectMapper;
        this.location = location;
    }

    /**
     * Create the bundle directory and an empty store for it.
     *
     * @throws ExportException if the directory cannot be created (unwritable output root)
     */
    public static PageStore open(ObjectMapper objectMapper, BundleLocation location) {
        try {
            Files.createDirectories(location.directory());
        } catch (IOException e) {
            throw new ExportException("Cannot create output directory", location.directory(), e);
        }
        return new PageStore(objectMapper, location);
    }

    /**
     * Persist a page and keep it for export.
     *
     * @throws ExportException if the page file cannot be written; the run cannot continue durably
     */
    public Path append(Page page) {
        if (finished) {
            throw new IllegalStateException("PageStore already finished: " + location.baseName());
        }
        int expected = pages.size() + 1;
        if (page.number() != expected) {
            throw new IllegalArgumentException("Expected page " + expected + " but got " + page.number());
        }

        Path path = location.pagePath(page.number());
        ArrayNode array = objectMapper.createArrayNode();
        page.records().forEach(array::add);
        try {
            AtomicFileWriter.write(path, writer -> objectMapper.writeValue(writer, array));
        } catch (IOException e) {
            throw new ExportException("Failed to write page " + page.number(), path, e);
        }

        pages.add(page);
        pageFiles.add(path);
        log.debug("Stored page {} ({} records) at {}", page.number(), page.size(), path);
        return path;
    }

    public List<Page> pages() {
        return Collections.unmodifiableList(pages);
    }

    public List<Path> pageFiles() {
        return Collections.unmodifiableList(pageFiles);
    }

    public int recordCount() {
        return pages.stream().mapToInt(Page::size).sum();
    }

    public BundleLocation location() {
        return location;
    }

    /**
     * Ends the store's life. With retention off the page files are deleted.
     *
     * @return the number of page files removed
     */
    public int finish(boolean retain) {
        finished = true;
        if (retain) {
            return 0;
        }
        int removed = 0;
        for (Path file : pageFiles) {
            try {
                if (Files.deleteIfExists(file)) {
                    removed++;
                }
            } catch (IOException e) {
                log.warn("Could not delete page file {}: {}", file, e.getMessage());
            }
        }
        pageFiles.clear();
        return removed;
    }
}
