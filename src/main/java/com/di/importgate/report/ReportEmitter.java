package com.di.importgate.report;

import com.di.importgate.pipeline.RunWorkspace;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Writes the result files of a run and hands the document to the renderer.
 *
 * <ul>
 *   <li>{@code validation_output.json}: the ordered records</li>
 *   <li>{@code validation_result.json}: verdict, stage statuses, abort details and emission time</li>
 *   <li>{@code failure_reason.json}: {@code {code, stage, message, limit}}, only when aborted</li>
 * </ul>
 *
 * <p>{@link #seed(RunWorkspace)} writes an empty record list at the start of a run so
 * the output file exists even when the process dies before the report stage.
 */
@Slf4j
@Service
public class ReportEmitter {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final ReportRenderer renderer;
    private final Clock clock;

    @Autowired
    public ReportEmitter(ReportRenderer renderer) {
        this(renderer, Clock.systemUTC());
    }

    ReportEmitter(ReportRenderer renderer, Clock clock) {
        this.renderer = renderer;
        this.clock = clock;
    }

    public void seed(RunWorkspace workspace) throws IOException {
        if (!Files.exists(workspace.resultDocument())) {
            writeAtomically(workspace.resultDocument(), "[]\n");
        }
    }

    public void emit(ResultDocument document, RunWorkspace workspace) throws IOException {
        writeAtomically(workspace.resultDocument(), MAPPER.writeValueAsString(document.getRecords()));

        ObjectNode summary = MAPPER.valueToTree(document);
        summary.remove("records");
        summary.set("emitted_at", MAPPER.valueToTree(Instant.now(clock)));
        writeAtomically(workspace.resultSummary(), MAPPER.writeValueAsString(summary));

        if (document.isAborted()) {
            Map<String, Object> reason = new LinkedHashMap<>();
            reason.put("code", document.getAbortCode());
            reason.put("stage", document.getAbortedAt());
            reason.put("message", document.getAbortMessage());
            reason.put("limit", document.getAbortLimit());
            writeAtomically(workspace.failureReason(), MAPPER.writeValueAsString(reason));
        } else {
            Files.deleteIfExists(workspace.failureReason());
        }
        log.info("[REPORT] Wrote {} record(s) to {}", document.getRecords().size(), workspace.resultDocument());

        try {
            renderer.render(document, workspace);
        } catch (RuntimeException e) {
            log.error("[REPORT] Renderer {} failed; result files are complete: {}",
                    renderer.getClass().getSimpleName(), e.getMessage(), e);
        }
    }

    private static void writeAtomically(Path target, String content) throws IOException {
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        Files.writeString(tmp, content, StandardCharsets.UTF_8);
        Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
    }
}
