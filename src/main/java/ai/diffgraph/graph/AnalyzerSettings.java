package ai.diffgraph.graph;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Runtime configuration of snapshot extraction.
 */
public record AnalyzerSettings(
        String pythonExecutable,   // interpreter for the Python summarizer
        Path pythonScript,         // null = bundled script
        Duration pythonTimeout,    // per file
        int threads                // extraction workers
) {
    public static final String PYTHON_ENV = "DIFFGRAPH_PYTHON";

    public AnalyzerSettings {
        Objects.requireNonNull(pythonExecutable, "pythonExecutable");
        Objects.requireNonNull(pythonTimeout, "pythonTimeout");
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1: " + threads);
        }
    }

    public static AnalyzerSettings defaults() {
        final String fromEnv = System.getenv(PYTHON_ENV);
        return new AnalyzerSettings(
                fromEnv == null || fromEnv.isBlank() ? "python3" : fromEnv,
                null,
                Duration.ofSeconds(30),
                Math.max(1, Runtime.getRuntime().availableProcessors()));
    }

    public AnalyzerSettings withPythonExecutable(String executable) {
        return new AnalyzerSettings(executable, pythonScript, pythonTimeout, threads);
    }

    public AnalyzerSettings withPythonScript(Path script) {
        return new AnalyzerSettings(pythonExecutable, script, pythonTimeout, threads);
    }

    public AnalyzerSettings withPythonTimeout(Duration timeout) {
        return new AnalyzerSettings(pythonExecutable, pythonScript, timeout, threads);
    }

    public AnalyzerSettings withThreads(int count) {
        return new AnalyzerSettings(pythonExecutable, pythonScript, pythonTimeout, count);
    }
}
