package org.tlin.minilogic.javaparser;

import java.util.Optional;

import org.tlin.minilogic.verify.VerificationReport;

/**
 * Why {@link RewriteGate} accepted or refused a suggestion.
 *
 * @param translated whether both snippets were lowered to IR
 * @param report     the equivalence report, absent when translation failed
 * @param safe       the gate's verdict
 */
public record GateDecision(boolean translated, VerificationReport report, boolean safe) {

    static GateDecision untranslatable() {
        return new GateDecision(false, null, false);
    }

    public Optional<VerificationReport> verification() {
        return Optional.ofNullable(report);
    }
}
