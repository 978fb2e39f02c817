package ai.diffgraph.scan;

/**
 * One file could not be turned into graph data. Always scoped to that file; the batch
 * carries on without its contribution.
 */
public final class ExtractionException extends Exception {

    public enum Reason {
        PARSE_FAILURE,
        SUBPROCESS_FAILURE,
        MALFORMED_SUMMARY
    }

    private final Reason reason;
    private final String path;

    public ExtractionException(Reason reason, String path, String message) {
        super(message);
        this.reason = reason;
        this.path = path;
    }

    public ExtractionException(Reason reason, String path, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.path = path;
    }

    public Reason reason() {
        return reason;
    }

    public String path() {
        return path;
    }
}
