package ai.diffgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum BranchKind {
    IF("if"),
    SWITCH("switch"),
    FOR("for"),
    WHILE("while"),
    TRY("try"),
    CATCH("catch"),
    FINALLY("finally"),
    RETURN("return"),
    THROW("throw"),
    TERNARY("ternary"),
    CALL("call"),
    THEN("then");

    private final String label;

    BranchKind(String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Kind of a statement-level call: promise chain links keep their own label.
     */
    public static BranchKind forCallee(String calleeName) {
        if (calleeName == null) {
            return CALL;
        }
        return switch (Ids.lastSegment(calleeName)) {
            case "then" -> THEN;
            case "catch" -> CATCH;
            case "finally" -> FINALLY;
            default -> CALL;
        };
    }

    public static BranchKind fromLabel(String label) {
        for (BranchKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        if ("elif".equals(label)) {
            return IF;
        }
        if ("raise".equals(label)) {
            return THROW;
        }
        return null;
    }
}
