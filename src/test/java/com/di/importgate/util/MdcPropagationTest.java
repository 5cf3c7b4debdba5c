package com.di.importgate.util;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("MdcPropagation Tests")
class MdcPropagationTest {

    @AfterEach
    void tearDown() {
        MDC.clear();
    }

    @Test
    @DisplayName("Should carry runId and dataset into a worker thread")
    void testWrapCallable_PropagatesContext() throws Exception {
        MDC.put("runId", "run-1");
        MDC.put("dataset", "child_birth");
        ExecutorService executor = Executors.newSingleThreadExecutor();
        try {
            String seen = executor.submit(MdcPropagation.wrapCallable(
                () -> MDC.get("runId") + "/" + MDC.get("dataset"))).get(5, TimeUnit.SECONDS);
            assertEquals("run-1/child_birth", seen);

            String after = executor.submit(() -> MDC.get("runId")).get(5, TimeUnit.SECONDS);
            assertNull(after, "context must be cleared after the wrapped task");
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Should run a wrapped runnable with the captured context")
    void testWrapRunnable() throws Exception {
        MDC.put("runId", "run-2");
        AtomicReference<String> seen = new AtomicReference<>();
        Runnable task = MdcPropagation.wrapRunnable(() -> seen.set(MDC.get("runId")));
        Thread thread = new Thread(task);
        thread.start();
        thread.join(5000);
        assertEquals("run-2", seen.get());
    }

    @Test
    @DisplayName("Should return an empty map when no context is set")
    void testCopyMdc_Empty() {
        assertTrue(MdcPropagation.copyMdc().isEmpty());
    }
}
