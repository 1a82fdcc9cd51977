package com.netintel.wigle.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Artifacts produced for one fetch target.
 */
@Value
@Builder
public class RunBundle {

    BundleLocation location;
    @Singular List<Path> retainedPages;
    Path csvFile;
    Path kmlFile;
    int recordCount;
    int rowCount;
    int placemarkCount;
    @Singular List<String> errors;

    public Optional<Path> csv() {
        return Optional.ofNullable(csvFile);
    }

    public Optional<Path> kml() {
        return Optional.ofNullable(kmlFile);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public List<Path> files() {
        List<Path> files = new ArrayList<>(retainedPages);
        csv().ifPresent(files::add);
        kml().ifPresent(files::add);
        return files;
    }
}
