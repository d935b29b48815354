package org.tlin.minilogic.eval;

import java.util.Optional;

import org.tlin.minilogic.ir.BinaryOp;
import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.Ir;
import org.tlin.minilogic.ir.UnaryOp;
import org.tlin.minilogic.value.Env;
import org.tlin.minilogic.value.Value;

/**
 * Sound, shallow deductions: boolean literals, variables bound to concrete booleans,
 * negation of a solvable condition, and structural self-(in)equality such as
 * {@code a == a}. Conditions containing a call are never solved.
 */
public final class BasicCondSolver implements CondSolver {

    public static final BasicCondSolver INSTANCE = new BasicCondSolver();

    @Override
    public Optional<Boolean> solve(Expr cond, Env env) {
        if (Ir.containsCall(cond)) {
            return Optional.empty();
        }
        return solveInner(cond, env);
    }

    private Optional<Boolean> solveInner(Expr cond, Env env) {
        if (cond instanceof Expr.Literal lit && lit.value() instanceof Value.BoolValue b) {
            return Optional.of(b.value());
        }
        if (cond instanceof Expr.Var v) {
            return env.get(v.name())
                    .filter(Value.BoolValue.class::isInstance)
                    .map(value -> ((Value.BoolValue) value).value());
        }
        if (cond instanceof Expr.Unary u && u.op() == UnaryOp.NOT) {
            return solveInner(u.operand(), env).map(b -> !b);
        }
        if (cond instanceof Expr.Binary b && (b.op() == BinaryOp.EQ || b.op() == BinaryOp.NEQ)) {
            // records compare structurally, so this is deep expression equality
            if (b.left().equals(b.right())) {
                return Optional.of(b.op() == BinaryOp.EQ);
            }
        }
        return Optional.empty();
    }
}
