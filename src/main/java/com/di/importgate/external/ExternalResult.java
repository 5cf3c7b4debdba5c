package com.di.importgate.external;

import java.time.Duration;

/**
 * What an external process left behind: exit status, whether it was stopped for
 * running too long, and the tail of its combined output.
 *
 * @param exitCode    process exit status; -1 when the process never started or was killed
 * @param timedOut    true when stopped by timeout or cancellation
 * @param launchError set when the process could not be started
 * @param outputTail  last lines of stdout and stderr
 */
public record ExternalResult(int exitCode, boolean timedOut, String launchError, String outputTail, Duration elapsed) {

    public static ExternalResult exited(int exitCode, String outputTail, Duration elapsed) {
        return new ExternalResult(exitCode, false, null, outputTail, elapsed);
    }

    public static ExternalResult timedOut(String outputTail, Duration elapsed) {
        return new ExternalResult(-1, true, null, outputTail, elapsed);
    }

    public static ExternalResult notStarted(String launchError) {
        return new ExternalResult(-1, false, launchError, "", Duration.ZERO);
    }

    public boolean succeeded() {
        return exitCode == 0 && !timedOut && launchError == null;
    }
}
