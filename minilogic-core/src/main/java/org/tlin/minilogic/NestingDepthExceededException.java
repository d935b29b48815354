package org.tlin.minilogic;

/**
 * Raised inside a tree walk when the IR nests deeper than the configured limit.
 * Walkers convert it to an {@code UNKNOWN} outcome before returning to their caller.
 */
public class NestingDepthExceededException extends MiniLogicException {

    private final int limit;

    public NestingDepthExceededException(int limit) {
        super("IR nesting depth exceeds limit of " + limit);
        this.limit = limit;
    }

    public int getLimit() {
        return limit;
    }
}
