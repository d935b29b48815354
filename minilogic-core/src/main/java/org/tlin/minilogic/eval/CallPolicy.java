package org.tlin.minilogic.eval;

public enum CallPolicy {

    /**
     * Calls are ordered side effects: arguments are evaluated, the call is logged, and
     * control flow is never affected.
     */
    OPAQUE,

    /**
     * Any statement or expression containing a call evaluates to {@code Unknown}.
     */
    DISALLOW
}
