package org.tlin.minilogic.verify;

/**
 * Outcome of an equivalence check. {@link #UNKNOWN} means "could not prove" and must never
 * be read as either of the other two.
 */
public enum VerificationResult {
    EQUIVALENT("Equivalent"),
    NOT_EQUIVALENT("NotEquivalent"),
    UNKNOWN("Unknown");

    private final String label;

    VerificationResult(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
