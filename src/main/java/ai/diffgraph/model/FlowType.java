package ai.diffgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FlowType {
    TRUE("true"),
    FALSE("false"),
    NEXT("next");

    private final String label;

    FlowType(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
