package org.tlin.minilogic.eval;

public enum ResultKind {
    CONTINUE("Continue"),
    RETURN("Return"),
    BREAK("Break"),
    CONTINUE_LOOP("ContinueLoop"),
    UNKNOWN("Unknown");

    private final String label;

    ResultKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
