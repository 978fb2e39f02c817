package ai.diffgraph.scan;

import ai.diffgraph.model.EdgeKind;

/**
 * An unresolved call or render found in one file. Names are matched against declared
 * symbols after every file of the snapshot has been extracted.
 */
public record CallSite(
        String filePath,
        String callerName,
        String calleeName,
        int line,
        EdgeKind kind          // CALLS or RENDERS
) {
}
