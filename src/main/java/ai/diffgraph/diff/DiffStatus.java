package ai.diffgraph.diff;

import com.fasterxml.jackson.annotation.JsonValue;

public enum DiffStatus {
    ADDED("added"),
    REMOVED("removed"),
    MODIFIED("modified"),
    UNCHANGED("unchanged");

    private final String label;

    DiffStatus(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }
}
