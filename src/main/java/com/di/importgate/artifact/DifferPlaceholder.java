package com.di.importgate.artifact;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Resolves the differ artifact handed to the rule engine. First-time imports have
 * none; the engine then gets a header plus a single all-zero row instead of an
 * empty file it cannot load.
 */
@Slf4j
public final class DifferPlaceholder {

    public static final String FILE_NAME = "empty_differ.csv";

    private DifferPlaceholder() {
    }

    /**
     * @param differFile supplied differ artifact, may be null
     * @param target     where to write the placeholder when needed
     * @param header     comma-separated placeholder header
     * @return the differ file to pass to the engine
     */
    public static Path resolve(Path differFile, Path target, String header) throws IOException {
        if (differFile != null && Files.isRegularFile(differFile) && hasDataRow(differFile)) {
            return differFile;
        }
        String[] columns = header.split(",");
        String zeroRow = Stream.concat(Stream.of(""), Collections.nCopies(columns.length - 1, "0").stream())
                .collect(Collectors.joining(","));
        Files.createDirectories(target.toAbsolutePath().getParent());
        Files.writeString(target, String.join(",", Arrays.asList(columns)) + "\n" + zeroRow + "\n", StandardCharsets.UTF_8);
        log.info("[VALIDATE] No differ data{}; using placeholder {}",
                differFile == null ? "" : " in " + differFile, target);
        return target;
    }

    private static boolean hasDataRow(Path file) throws IOException {
        try (Stream<String> lines = Files.lines(file, StandardCharsets.UTF_8)) {
            return lines.filter(l -> !l.isBlank()).limit(2).count() > 1;
        }
    }
}
