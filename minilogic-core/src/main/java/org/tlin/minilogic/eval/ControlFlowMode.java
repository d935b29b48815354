package org.tlin.minilogic.eval;

public enum ControlFlowMode {

    /**
     * Return, break and continue are not modeled and evaluate to {@code Unknown}.
     */
    NO_TERMINATION,

    EARLY_RETURN_AWARE
}
