package io.querymesh.transpile;

import com.fasterxml.jackson.databind.JsonNode;
import io.querymesh.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external engine once per query. The request goes to stdin as one JSON object; the
 * engine answers on stdout with the {@link TranspileResult} fields, or with {@code {"error": "..."}}.
 */
public final class ScriptTranspiler implements Transpiler {
    private static final int MAX_ERROR_CHARS = 512;
    private static final long OUTPUT_GRACE_MS = 1_000L;
    private static final ExecutorService OUTPUT_READERS = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "querymesh-script-output");
        thread.setDaemon(true);
        return thread;
    });

    private final String id;
    private final List<String> command;
    private final long timeoutMs;

    public ScriptTranspiler(String id, List<String> command, long timeoutMs) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("script transpiler id cannot be empty");
        }
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("script transpiler command cannot be empty: " + id);
        }
        this.id = id;
        this.command = List.copyOf(command);
        this.timeoutMs = Math.max(1_000L, timeoutMs);
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public TranspileResult transpile(TranspileRequest request) throws TranspileException {
        ProcessBuilder pb = new ProcessBuilder(new ArrayList<>(command));
        pb.redirectError(ProcessBuilder.Redirect.DISCARD);
        Process process;
        try {
            process = pb.start();
        } catch (IOException e) {
            throw new TranspilerUnavailableException("script spawn failed: " + e.getMessage(), e);
        }

        // Drained while the engine runs; an answer larger than the pipe buffer would block it otherwise.
        CompletableFuture<byte[]> stdout = CompletableFuture.supplyAsync(
                () -> readFully(process.getInputStream()), OUTPUT_READERS
        );
        String output;
        try {
            process.getOutputStream().write(Jsons.toCompactJson(request).getBytes(StandardCharsets.UTF_8));
            process.getOutputStream().flush();
            process.getOutputStream().close();

            boolean finished = process.waitFor(timeoutMs, TimeUnit.MILLISECONDS);
            if (!finished) {
                process.destroyForcibly();
                process.waitFor(1, TimeUnit.SECONDS);
                stdout.cancel(true);
                throw new TranspileException("script timeout after " + Duration.ofMillis(timeoutMs));
            }
            output = new String(stdout.get(OUTPUT_GRACE_MS, TimeUnit.MILLISECONDS), StandardCharsets.UTF_8);
        } catch (IOException e) {
            process.destroyForcibly();
            throw new TranspilerUnavailableException("script I/O failed: " + e.getMessage(), e);
        } catch (TimeoutException e) {
            stdout.cancel(true);
            throw new TranspileException("script exited but its output stayed open", e);
        } catch (ExecutionException e) {
            process.destroyForcibly();
            Throwable cause = e.getCause() == null ? e : e.getCause();
            throw new TranspilerUnavailableException("script output read failed: " + cause.getMessage(), cause);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            stdout.cancel(true);
            Thread.currentThread().interrupt();
            throw new TranspilerUnavailableException("interrupted while waiting for script", e);
        }

        if (process.exitValue() != 0) {
            throw new TranspileException("script exit=" + process.exitValue() + " output=" + truncate(output));
        }
        JsonNode node;
        try {
            node = Jsons.mapper().readTree(output);
        } catch (IOException e) {
            throw new TranspileException("script returned invalid JSON: " + truncate(output), e);
        }
        if (node == null || !node.isObject()) {
            throw new TranspileException("script returned no JSON object: " + truncate(output));
        }
        String error = node.path("error").asText("");
        if (!error.isBlank()) {
            throw new TranspileException(truncate(error));
        }
        try {
            return Jsons.mapper().treeToValue(node, TranspileResult.class);
        } catch (IOException e) {
            throw new TranspileException("script returned an unexpected shape: " + truncate(output), e);
        }
    }

    private static byte[] readFully(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private String truncate(String raw) {
        if (raw == null) {
            return "";
        }
        String normalized = raw.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_ERROR_CHARS) {
            return normalized;
        }
        return normalized.substring(0, MAX_ERROR_CHARS) + "...";
    }
}
