package ai.diffgraph.scan;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Runs the bundled Python summarizer, one process per file. Output streams are drained on
 * a private daemon pool so a chatty or stuck child never blocks the caller past the
 * timeout.
 */
public final class ProcessSummaryClient implements SummaryClient {

    private static final Logger log = LoggerFactory.getLogger(ProcessSummaryClient.class);

    static final String SCRIPT_RESOURCE = "/scripts/analyze_python.py";

    private static final ExecutorService STREAM_READERS = Executors.newCachedThreadPool(r -> {
        final Thread t = new Thread(r, "python-summary-reader");
        t.setDaemon(true);
        return t;
    });

    private static Path extractedScript;

    private final String pythonExecutable;
    private final Path scriptOverride;
    private final Duration timeout;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param scriptOverride script to run instead of the bundled one, may be null
     */
    public ProcessSummaryClient(String pythonExecutable, Path scriptOverride, Duration timeout) {
        this.pythonExecutable = Objects.requireNonNull(pythonExecutable, "pythonExecutable");
        this.scriptOverride = scriptOverride;
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    @Override
    public String summarize(String path, String content) throws ExtractionException {
        final Path script = scriptPath(path);
        final Process process;
        try {
            process = new ProcessBuilder(pythonExecutable, script.toString()).start();
        } catch (IOException e) {
            throw failure(path, "cannot start " + pythonExecutable + ": " + e.getMessage(), e);
        }

        final CompletableFuture<String> stdout = drain(process.getInputStream());
        final CompletableFuture<String> stderr = drain(process.getErrorStream());
        try {
            try (OutputStream stdin = process.getOutputStream()) {
                stdin.write(mapper.writeValueAsBytes(Map.of("content", content)));
            }
            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                throw failure(path, "summarizer timed out after " + timeout.toSeconds() + "s", null);
            }
            final String errors = stderr.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!errors.isBlank()) {
                throw failure(path, "summarizer stderr: " + errors.strip(), null);
            }
            if (process.exitValue() != 0) {
                throw failure(path, "summarizer exited with " + process.exitValue(), null);
            }
            return stdout.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (IOException | ExecutionException | TimeoutException e) {
            throw failure(path, "summarizer I/O failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw failure(path, "interrupted while waiting for summarizer", e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    private Path scriptPath(String path) throws ExtractionException {
        if (scriptOverride != null) {
            return scriptOverride;
        }
        synchronized (ProcessSummaryClient.class) {
            if (extractedScript == null) {
                try (InputStream in = ProcessSummaryClient.class.getResourceAsStream(SCRIPT_RESOURCE)) {
                    if (in == null) {
                        throw failure(path, "missing resource " + SCRIPT_RESOURCE, null);
                    }
                    final Path target = Files.createTempFile("analyze_python", ".py");
                    Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
                    target.toFile().deleteOnExit();
                    extractedScript = target;
                    log.debug("Extracted Python summarizer to {}", target);
                } catch (IOException e) {
                    throw failure(path, "cannot extract summarizer script: " + e.getMessage(), e);
                }
            }
            return extractedScript;
        }
    }

    private static CompletableFuture<String> drain(InputStream stream) {
        return CompletableFuture.supplyAsync(() -> {
            try (InputStream in = stream) {
                return new String(in.readAllBytes(), StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        }, STREAM_READERS);
    }

    private static ExtractionException failure(String path, String message, Throwable cause) {
        return new ExtractionException(ExtractionException.Reason.SUBPROCESS_FAILURE, path, message, cause);
    }
}
