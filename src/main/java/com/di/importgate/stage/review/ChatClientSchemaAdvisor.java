package com.di.importgate.stage.review;

import com.di.importgate.config.ImportGateProperties;
import com.di.importgate.exception.AdvisorUnavailableException;
import com.di.importgate.pipeline.FailureCode;
import com.di.importgate.util.MdcPropagation;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.BooleanSupplier;

/**
 * Asks a chat model to review the mapping. The model must answer with a JSON array of
 * findings; anything else is an advisor failure.
 *
 * <p>Works with whichever {@link ChatModel} bean the deployment provides (Vertex AI
 * Gemini, OpenAI, ...). Without one, every review fails with
 * {@link AdvisorUnavailableException}.
 */
@Slf4j
@Component
public class ChatClientSchemaAdvisor implements SchemaAdvisor {

    public static final String TYPE = "chat";

    /** Characters of each input file included in the prompt. */
    static final int MAX_FILE_CHARS = 20_000;
    static final int MAX_TABLE_LINES = 20;
    private static final long POLL_MILLIS = 200;

    private final ObjectProvider<ChatModel> chatModel;
    private final ImportGateProperties properties;
    private final Resource systemPrompt;
    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "schema-advisor");
        t.setDaemon(true);
        return t;
    });

    public ChatClientSchemaAdvisor(ObjectProvider<ChatModel> chatModel,
                                   ImportGateProperties properties,
                                   @Value("classpath:prompts/schema-review-system.st") Resource systemPrompt) {
        this.chatModel = chatModel;
        this.properties = properties;
        this.systemPrompt = systemPrompt;
    }

    @Override
    public String type() {
        return TYPE;
    }

    @Override
    public List<AdvisorFinding> review(ReviewRequest request) {
        ChatModel model = chatModel.getIfAvailable();
        if (model == null) {
            throw new AdvisorUnavailableException("No ChatModel is configured for the chat schema advisor");
        }
        ImportGateProperties.AdvisorConfig config = properties.getReview().getAdvisor();
        String userPrompt = buildPrompt(request);
        ChatClient client = ChatClient.builder(model).build();

        log.info("[SCHEMA-REVIEW] Sending {} to chat advisor ({} chars)", request.mappingFile().getFileName(), userPrompt.length());
        long start = System.currentTimeMillis();
        Future<String> answer = executor.submit(MdcPropagation.wrapCallable(() -> client.prompt()
                .system(readResource(systemPrompt))
                .user(userPrompt)
                .call()
                .content()));
        String content;
        try {
            content = await(answer, config.getTimeoutSeconds(), request.cancelled());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new AdvisorUnavailableException("Chat advisor call failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            answer.cancel(true);
            throw new AdvisorUnavailableException("Chat advisor call interrupted", e);
        }
        log.info("[SCHEMA-REVIEW] Chat advisor answered in {}ms", System.currentTimeMillis() - start);
        return AdvisorFindingParser.parse(content, config.getMaxFindings());
    }

    /**
     * Waits for the answer in short slices, giving up on timeout (zero means none) or
     * cancellation.
     */
    private static String await(Future<String> answer, int timeoutSeconds, BooleanSupplier cancelled)
            throws ExecutionException, InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(timeoutSeconds);
        while (true) {
            try {
                return answer.get(POLL_MILLIS, TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                if (cancelled.getAsBoolean()) {
                    answer.cancel(true);
                    throw new AdvisorUnavailableException(FailureCode.TIMEOUT, "Chat advisor stopped: run was cancelled");
                }
                if (timeoutSeconds > 0 && System.nanoTime() - deadline > 0) {
                    answer.cancel(true);
                    throw new AdvisorUnavailableException(FailureCode.TIMEOUT,
                            String.format("Chat advisor did not answer within %ds", timeoutSeconds));
                }
            }
        }
    }

    String buildPrompt(ReviewRequest request) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Review this template MCF mapping file for schema problems.\n\n");
        appendFile(prompt, "Mapping file", request.mappingFile(), Integer.MAX_VALUE);
        if (request.dataTable() != null) {
            appendFile(prompt, "Data table (first rows)", request.dataTable(), MAX_TABLE_LINES);
        }
        for (Path metadata : request.metadataFiles()) {
            appendFile(prompt, "Metadata file", metadata, Integer.MAX_VALUE);
        }
        prompt.append("""
                Answer with a JSON array only. Each element has the fields \
                "type", "message", "suggestion", "line" and "file". \
                Answer [] when there is nothing to report.
                """);
        return prompt.toString();
    }

    private static void appendFile(StringBuilder prompt, String label, Path file, int maxLines) {
        prompt.append("### ").append(label).append(": ").append(file.getFileName()).append('\n');
        String text;
        try {
            List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
            text = String.join("\n", lines.subList(0, Math.min(maxLines, lines.size())));
        } catch (IOException e) {
            throw new AdvisorUnavailableException("Cannot read " + file + " for review: " + e.getMessage(), e);
        }
        if (text.length() > MAX_FILE_CHARS) {
            text = text.substring(0, MAX_FILE_CHARS) + "\n[truncated]";
        }
        prompt.append(text).append("\n\n");
    }

    private static String readResource(Resource resource) throws IOException {
        try (var in = resource.getInputStream()) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @PreDestroy
    void shutdown() {
        executor.shutdownNow();
    }
}
