package ai.diffgraph.scan;

import ai.diffgraph.model.Ids;

/**
 * Display text for branch nodes.
 */
public final class Snippets {

    public static final int MAX_LENGTH = 70;

    private Snippets() {
    }

    public static String bounded(String text) {
        final String collapsed = Ids.collapseWhitespace(text);
        if (collapsed.length() <= MAX_LENGTH) {
            return collapsed;
        }
        return collapsed.substring(0, MAX_LENGTH - 3) + "...";
    }

    public static String firstLine(String text) {
        if (text == null) {
            return "";
        }
        final int nl = text.indexOf('\n');
        return nl >= 0 ? text.substring(0, nl) : text;
    }

    public static String stripExtension(String path) {
        final int slash = path.lastIndexOf('/');
        final int dot = path.lastIndexOf('.');
        return dot > slash ? path.substring(0, dot) : path;
    }
}
