package org.tlin.minilogic.eval;

import java.util.Optional;

import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.value.Env;

/**
 * Deduces the truth value of a condition the evaluator could not compute concretely.
 * An empty result is not an error: the evaluator falls back to evaluating both branches.
 */
@FunctionalInterface
public interface CondSolver {

    Optional<Boolean> solve(Expr cond, Env env);
}
