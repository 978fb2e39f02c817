package ai.diffgraph.diff;

import java.util.ArrayList;
import java.util.List;

/**
 * Depth-aware scanning of parameter lists and array literals. Delimiters only count at
 * nesting depth zero and outside string literals, so defaults, generics and destructuring
 * patterns stay in one piece.
 */
public final class TopLevelSplitter {

    private TopLevelSplitter() {
    }

    /** Trimmed, non-empty pieces of {@code value} between top-level delimiters. */
    public static List<String> split(String value, char delimiter) {
        final List<String> parts = new ArrayList<>();
        if (value == null || value.isBlank()) {
            return parts;
        }
        int from = 0;
        int at;
        while ((at = indexFrom(value, delimiter, from)) >= 0) {
            addPart(parts, value.substring(from, at));
            from = at + 1;
        }
        addPart(parts, value.substring(from));
        return parts;
    }

    /** Index of the first top-level {@code target}, or -1. */
    public static int firstTopLevelIndex(String value, char target) {
        if (value == null) {
            return -1;
        }
        return indexFrom(value, target, 0);
    }

    private static int indexFrom(String value, char target, int from) {
        int depth = 0;
        int angle = 0;
        char quote = 0;
        for (int i = from; i < value.length(); i++) {
            final char c = value.charAt(i);
            if (quote != 0) {
                if (c == '\\') {
                    i++;
                } else if (c == quote) {
                    quote = 0;
                }
                continue;
            }
            if (c == '\'' || c == '"' || c == '`') {
                quote = c;
                continue;
            }
            if (depth == 0 && angle == 0 && c == target && !isOperatorPart(value, i)) {
                return i;
            }
            switch (c) {
                case '(', '{', '[' -> depth++;
                case ')', '}', ']' -> depth = Math.max(0, depth - 1);
                case '<' -> {
                    if (opensGeneric(value, i)) {
                        angle++;
                    }
                }
                case '>' -> {
                    if (angle > 0 && value.charAt(i - 1) != '=') {
                        angle--;
                    }
                }
                default -> {
                }
            }
        }
        return -1;
    }

    /**
     * A {@code <} opens a type argument list when it is glued to a name ({@code Map<K, V>})
     * or stands where a type starts ({@code cb: <T>(x: T) => T}). Anything else, such as
     * {@code x < y} in a default value, is a comparison.
     */
    private static boolean opensGeneric(String value, int i) {
        if (i > 0 && isIdentifierChar(value.charAt(i - 1))) {
            return i + 1 < value.length() && !Character.isWhitespace(value.charAt(i + 1));
        }
        int j = i - 1;
        while (j >= 0 && Character.isWhitespace(value.charAt(j))) {
            j--;
        }
        return j < 0 || ":|&(,<[".indexOf(value.charAt(j)) >= 0;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$';
    }

    // '=' that belongs to '=>', '==', '<=', '>=', '!='
    private static boolean isOperatorPart(String value, int i) {
        if (value.charAt(i) != '=') {
            return false;
        }
        final char next = i + 1 < value.length() ? value.charAt(i + 1) : 0;
        final char prev = i > 0 ? value.charAt(i - 1) : 0;
        return next == '>' || next == '=' || prev == '=' || prev == '!' || prev == '<' || prev == '>';
    }

    private static void addPart(List<String> parts, String raw) {
        final String trimmed = raw.trim();
        if (!trimmed.isEmpty()) {
            parts.add(trimmed);
        }
    }
}
