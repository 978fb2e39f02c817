package ai.diffgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NodeKind {
    FILE("File"),
    CLASS("Class"),
    FUNCTION("Function"),
    METHOD("Method"),
    BRANCH("Branch"),
    COMPONENT("Component"),
    HOOK("Hook");

    private final String label;

    NodeKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    public boolean isFunctionLike() {
        return this == FUNCTION || this == METHOD || this == COMPONENT || this == HOOK;
    }
}
