package com.di.importgate.runner;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.exception.ExternalToolException;
import com.di.importgate.pipeline.FailureCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.zip.ZipFile;

/**
 * Locates the generation tool jar: the configured path, then the bin directory, then
 * a download from the configured URL into the bin directory.
 *
 * <p>Downloads are retried up to {@code importgate.generation.download-attempts} times.
 * Every candidate, found or downloaded, must be a non-empty readable jar; a download
 * that fails that check is deleted and fetched again.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ImportToolProvisioner {

    private final ImportGateProperties properties;

    private Duration retryDelay = Duration.ofSeconds(2);

    /**
     * @return path of a verified tool jar
     * @throws ExternalToolException when no usable jar can be found or fetched
     */
    public Path resolve() {
        ImportGateProperties.GenerationConfig config = properties.getGeneration();
        if (config.getJarPath() != null && !config.getJarPath().isBlank()) {
            Path configured = Paths.get(config.getJarPath());
            if (isUsableJar(configured)) {
                log.info("[PROVISION] Using configured tool jar {}", configured);
                return configured;
            }
            log.warn("[PROVISION] Configured tool jar {} is missing or not a jar", configured);
        }

        Path cached = Paths.get(config.getBinDir()).resolve(jarFileName(config.getJarUrl()));
        if (isUsableJar(cached)) {
            log.info("[PROVISION] Using cached tool jar {}", cached);
            return cached;
        }
        return download(config, cached);
    }

    private Path download(ImportGateProperties.GenerationConfig config, Path target) {
        if (config.getJarUrl() == null || config.getJarUrl().isBlank()) {
            throw new ExternalToolException(FailureCode.DATA_PROCESSING_FAILED,
                    "Generation tool jar not found and no download URL configured");
        }
        URI uri = URI.create(config.getJarUrl());
        String lastError = null;
        for (int attempt = 1; attempt <= config.getDownloadAttempts(); attempt++) {
            Path partial = target.resolveSibling(target.getFileName() + ".part");
            try {
                Files.createDirectories(target.toAbsolutePath().getParent());
                log.info("[PROVISION] Downloading {} (attempt {}/{})", uri, attempt, config.getDownloadAttempts());
                fetch(uri, partial);
                if (!isUsableJar(partial)) {
                    throw new IOException("downloaded file is empty or not a jar");
                }
                Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);
                log.info("[PROVISION] Tool jar ready: {}", target);
                return target;
            } catch (IOException | RuntimeException e) {
                lastError = e.getMessage();
                log.warn("[PROVISION] Attempt {} failed: {}", attempt, lastError);
                deleteQuietly(partial);
                if (attempt < config.getDownloadAttempts()) {
                    pause();
                }
            }
        }
        throw new ExternalToolException(FailureCode.DATA_PROCESSING_FAILED, String.format(
                "Could not fetch generation tool from %s after %d attempt(s): %s", uri, config.getDownloadAttempts(), lastError));
    }

    /** Streams the URL body into {@code target}. */
    void fetch(URI uri, Path target) throws IOException {
        RestClient.create().get().uri(uri).exchange((request, response) -> {
            if (!response.getStatusCode().is2xxSuccessful()) {
                throw new IOException("HTTP " + response.getStatusCode().value());
            }
            try (InputStream body = response.getBody()) {
                Files.copy(body, target, StandardCopyOption.REPLACE_EXISTING);
            }
            return null;
        });
    }

    static boolean isUsableJar(Path file) {
        try {
            if (!Files.isRegularFile(file) || Files.size(file) == 0) {
                return false;
            }
            try (ZipFile zip = new ZipFile(file.toFile())) {
                return zip.entries().hasMoreElements();
            }
        } catch (IOException e) {
            log.debug("[PROVISION] {} is not a readable jar: {}", file, e.getMessage());
            return false;
        }
    }

    static String jarFileName(String url) {
        if (url == null || url.isBlank()) {
            return "datacommons-import-tool.jar";
        }
        String path = URI.create(url).getPath();
        String name = path == null ? "" : path.substring(path.lastIndexOf('/') + 1);
        return name.isEmpty() ? "datacommons-import-tool.jar" : name;
    }

    void setRetryDelay(Duration retryDelay) {
        this.retryDelay = retryDelay;
    }

    private void pause() {
        try {
            Thread.sleep(retryDelay.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException(FailureCode.DATA_PROCESSING_FAILED, "Interrupted while fetching the generation tool", e);
        }
    }

    private static void deleteQuietly(Path file) {
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.warn("[PROVISION] Cannot delete {}: {}", file, e.getMessage());
        }
    }
}
