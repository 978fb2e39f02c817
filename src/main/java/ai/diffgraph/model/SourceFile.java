package ai.diffgraph.model;

import java.util.Objects;

/**
 * One already-selected input file: repo-relative path (forward slashes) and its text.
 */
public record SourceFile(String path, String content) {

    public SourceFile {
        Objects.requireNonNull(path, "path");
        Objects.requireNonNull(content, "content");
    }

    public String fileName() {
        final int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }

    public int lineCount() {
        if (content.isEmpty()) {
            return 0;
        }
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n' && i < content.length() - 1) {
                lines++;
            }
        }
        return lines;
    }
}
