package com.di.importgate.external;

import com.di.importgate.util.MdcPropagation;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

/**
 * {@link ExternalStep} backed by an operating-system process.
 *
 * <p>stderr is merged into stdout and drained on a helper thread that carries the
 * run's MDC, so tool output shows up in the run log. The wait loop polls for
 * cancellation; a timeout or cancellation destroys the process tree.
 */
@Slf4j
@Component
public class ProcessExternalStep implements ExternalStep {

    private static final int TAIL_LINES = 40;
    private static final long POLL_MILLIS = 200;

    @Override
    public ExternalResult invoke(ExternalInvocation invocation) {
        String tool = invocation.getTool();
        ProcessBuilder builder = new ProcessBuilder(invocation.getCommand()).redirectErrorStream(true);
        if (invocation.getWorkingDir() != null) {
            builder.directory(invocation.getWorkingDir().toFile());
        }
        builder.environment().putAll(invocation.getEnvironment());

        log.info("[EXTERNAL] Starting {}: {}", tool, String.join(" ", invocation.getCommand()));
        long start = System.nanoTime();
        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            log.error("[EXTERNAL] {} could not be started: {}", tool, e.getMessage());
            return ExternalResult.notStarted(e.getMessage());
        }

        Deque<String> tail = new ArrayDeque<>();
        Thread drainer = new Thread(MdcPropagation.wrapRunnable(() -> drain(tool, process, tail)), "drain-" + tool);
        drainer.setDaemon(true);
        drainer.start();

        try {
            boolean finished = waitFor(process, invocation);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            if (!finished) {
                process.descendants().forEach(ProcessHandle::destroyForcibly);
                process.destroyForcibly();
                drainer.join(TimeUnit.SECONDS.toMillis(2));
                log.warn("[EXTERNAL] {} stopped after {}s (timeout or cancellation)", tool, elapsed.toSeconds());
                return ExternalResult.timedOut(snapshot(tail), elapsed);
            }
            drainer.join(TimeUnit.SECONDS.toMillis(5));
            int exit = process.exitValue();
            log.info("[EXTERNAL] {} exited with status {} in {} ms", tool, exit, elapsed.toMillis());
            return ExternalResult.exited(exit, snapshot(tail), elapsed);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
            return ExternalResult.timedOut(snapshot(tail), Duration.ofNanos(System.nanoTime() - start));
        }
    }

    private boolean waitFor(Process process, ExternalInvocation invocation) throws InterruptedException {
        Duration timeout = invocation.getTimeout();
        boolean bounded = timeout != null && !timeout.isZero() && !timeout.isNegative();
        long deadline = bounded ? System.nanoTime() + timeout.toNanos() : 0;
        while (true) {
            if (process.waitFor(POLL_MILLIS, TimeUnit.MILLISECONDS)) {
                return true;
            }
            if (invocation.getCancelled().getAsBoolean()) {
                log.warn("[EXTERNAL] {} cancelled", invocation.getTool());
                return false;
            }
            if (bounded && System.nanoTime() - deadline > 0) {
                return false;
            }
        }
    }

    private void drain(String tool, Process process, Deque<String> tail) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                log.debug("[{}] {}", tool, line);
                synchronized (tail) {
                    tail.addLast(line);
                    if (tail.size() > TAIL_LINES) {
                        tail.removeFirst();
                    }
                }
            }
        } catch (IOException e) {
            log.debug("[EXTERNAL] Output of {} closed: {}", tool, e.getMessage());
        }
    }

    private static String snapshot(Deque<String> tail) {
        synchronized (tail) {
            return String.join("\n", tail);
        }
    }
}
