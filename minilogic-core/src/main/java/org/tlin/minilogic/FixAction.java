package org.tlin.minilogic;

import org.tlin.minilogic.verify.VerificationReport;

/**
 * What an auto-fix consumer does with a verified rewrite.
 */
public enum FixAction {
    /** Proven equivalent: apply without asking. */
    APPLY,
    /** Not provable either way: warn and ask for confirmation. */
    CONFIRM,
    /** Proven different: drop the rewrite and flag the rule that produced it. */
    REJECT;

    public static FixAction of(VerificationReport report) {
        switch (report.result()) {
            case EQUIVALENT:
                return APPLY;
            case NOT_EQUIVALENT:
                return REJECT;
            default:
                return CONFIRM;
        }
    }
}
