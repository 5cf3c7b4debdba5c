package com.di.importgate.stage.review;

import java.nio.file.Path;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Inputs for one advisor review.
 *
 * @param mappingFile   template MCF to review
 * @param dataTable     data table, or null when not available
 * @param metadataFiles metadata MCF files, possibly empty
 * @param outputFile    where file-based advisors write their findings
 * @param cancelled     external stop request; advisors give up when it returns true
 */
public record ReviewRequest(Path mappingFile, Path dataTable, List<Path> metadataFiles, Path outputFile,
                            BooleanSupplier cancelled) {

    public ReviewRequest {
        metadataFiles = metadataFiles == null ? List.of() : List.copyOf(metadataFiles);
        cancelled = cancelled == null ? () -> false : cancelled;
    }

    public ReviewRequest(Path mappingFile, Path dataTable, List<Path> metadataFiles, Path outputFile) {
        this(mappingFile, dataTable, metadataFiles, outputFile, null);
    }
}
