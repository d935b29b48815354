package org.tlin.minilogic.ir;

/**
 * Visitor over the closed set of {@link Stmt} variants.
 */
public interface StmtVisitor<R, A> {

    R visit(Stmt.Assign n, A arg);

    R visit(Stmt.DeclAssign n, A arg);

    R visit(Stmt.VarDecl n, A arg);

    R visit(Stmt.Seq n, A arg);

    R visit(Stmt.Block n, A arg);

    R visit(Stmt.If n, A arg);

    R visit(Stmt.Return n, A arg);

    R visit(Stmt.Break n, A arg);

    R visit(Stmt.Continue n, A arg);

    R visit(Stmt.Call n, A arg);

    R visit(Stmt.Noop n, A arg);
}
