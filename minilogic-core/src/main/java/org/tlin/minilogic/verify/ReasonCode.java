package org.tlin.minilogic.verify;

public enum ReasonCode {
    NONE("none"),
    SAME_RESULT("same result for all environments"),
    DIFFERENT_KIND("different result kinds"),
    DIFFERENT_ENV("different environments"),
    DIFFERENT_VALUE("different return values"),
    DIFFERENT_CALLS("different call sequences"),
    SYMBOLIC_CONDITION("symbolic condition - cannot determine branch"),
    OUT_OF_SCOPE("rewrite outside MiniLogic scope"),
    CALLS_DISALLOWED("function calls not allowed"),
    SCOPE_VIOLATION("init-scoped variable used outside scope");

    private final String description;

    ReasonCode(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
