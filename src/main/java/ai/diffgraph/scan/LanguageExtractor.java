package ai.diffgraph.scan;

import ai.diffgraph.model.SourceFile;

/**
 * Front end for one source language. Implementations either parse in process or hand the
 * file to an external summarizer; callers cannot tell the difference.
 *
 * <p>An invocation owns whatever parse state it creates for the duration of the call, so
 * one extractor instance may serve several files concurrently.
 */
public interface LanguageExtractor {

    boolean supports(String path);

    FileExtraction extract(SourceFile file, ExtractionContext context) throws ExtractionException;
}
