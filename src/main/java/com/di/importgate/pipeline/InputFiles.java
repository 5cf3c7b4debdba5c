package com.di.importgate.pipeline;

import java.nio.file.Path;
import java.util.List;

/**
 * Resolved input paths of a run. Only the mapping file and data table are required.
 */
public record InputFiles(Path mappingFile, Path dataTable, List<Path> metadataFiles, Path differFile) {

    public InputFiles {
        metadataFiles = metadataFiles == null ? List.of() : List.copyOf(metadataFiles);
    }

    public boolean hasMetadata() {
        return !metadataFiles.isEmpty();
    }
}
