package ai.diffgraph.scan;

/**
 * One request/response exchange with an external summarizer: file content in, summary
 * JSON text out.
 */
@FunctionalInterface
public interface SummaryClient {

    String summarize(String path, String content) throws ExtractionException;
}
