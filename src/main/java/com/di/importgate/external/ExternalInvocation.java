package com.di.importgate.external;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * One external process call: command line, working directory and limits.
 */
@Value
@Builder
public class ExternalInvocation {

    /** Short tool name for logs and findings, e.g. {@code genmcf}. */
    String tool;
    @Singular("arg")
    List<String> command;
    Path workingDir;
    /** Wall-clock limit; null or zero means none. */
    Duration timeout;
    @Singular("env")
    Map<String, String> environment;
    /** Checked while waiting; returning true stops the process like a timeout. */
    @Builder.Default
    BooleanSupplier cancelled = () -> false;
}
