package org.tlin.minilogic.ir;

/**
 * Visitor over the closed set of {@link Expr} variants. Adding a variant breaks every
 * implementation at compile time.
 */
public interface ExprVisitor<R, A> {

    R visit(Expr.Literal n, A arg);

    R visit(Expr.Var n, A arg);

    R visit(Expr.Binary n, A arg);

    R visit(Expr.Unary n, A arg);

    R visit(Expr.Call n, A arg);
}
