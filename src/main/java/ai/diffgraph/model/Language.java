package ai.diffgraph.model;

import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum Language {
    TS("ts"),
    JS("js"),
    PY("py"),
    UNKNOWN("unknown");

    private final String label;

    Language(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public static Language fromPath(String path) {
        final String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".ts") || lower.endsWith(".tsx")) {
            return TS;
        }
        if (lower.endsWith(".js") || lower.endsWith(".jsx") || lower.endsWith(".mjs") || lower.endsWith(".cjs")) {
            return JS;
        }
        if (lower.endsWith(".py")) {
            return PY;
        }
        return UNKNOWN;
    }
}
