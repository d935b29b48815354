package org.tlin.minilogic;

import java.util.Objects;

import org.tlin.minilogic.ir.Stmt;

/**
 * A rewrite proposed by a rule, with where it came from.
 *
 * @param location {@code file:line} of the rewritten code, may be empty
 */
public record TransformationContext(Stmt original, Stmt transformed, String ruleName, String location) {

    public TransformationContext {
        Objects.requireNonNull(original, "original");
        Objects.requireNonNull(transformed, "transformed");
        ruleName = ruleName == null ? "" : ruleName;
        location = location == null ? "" : location;
    }

    public static TransformationContext of(String ruleName, Stmt original, Stmt transformed) {
        return new TransformationContext(original, transformed, ruleName, "");
    }
}
