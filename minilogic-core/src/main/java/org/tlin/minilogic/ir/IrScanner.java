package org.tlin.minilogic.ir;

import org.tlin.minilogic.NestingDepthExceededException;

/**
 * Walks every node of a statement or expression tree. Subclasses override the visit
 * methods they care about and call {@code super} to keep descending.
 * <p>
 * Right-nested {@link Stmt.Seq} spines are walked iteratively. Every other kind of nesting
 * counts against {@code maxDepth}: blocks, conditionals, a sequence in first position of
 * another, and operands and arguments of expressions. Instances carry walk state and are
 * not meant to be shared between threads.
 */
public abstract class IrScanner<A> implements StmtVisitor<Void, A>, ExprVisitor<Void, A> {

    public static final int DEFAULT_MAX_DEPTH = 256;

    private final int maxDepth;
    private int depth;

    protected IrScanner() {
        this(DEFAULT_MAX_DEPTH);
    }

    protected IrScanner(int maxDepth) {
        this.maxDepth = maxDepth;
    }

    public void scan(Stmt stmt, A arg) {
        if (stmt != null) {
            stmt.accept(this, arg);
        }
    }

    public void scan(Expr expr, A arg) {
        if (expr != null) {
            expr.accept(this, arg);
        }
    }

    protected void enter() {
        if (++depth > maxDepth) {
            throw new NestingDepthExceededException(maxDepth);
        }
    }

    protected void exit() {
        depth--;
    }

    private void scanNested(Stmt stmt, A arg) {
        enter();
        try {
            scan(stmt, arg);
        } finally {
            exit();
        }
    }

    private void scanNested(Expr expr, A arg) {
        enter();
        try {
            scan(expr, arg);
        } finally {
            exit();
        }
    }

    // ── Statements ───────────────────────────────────────────────────────

    @Override
    public Void visit(Stmt.Assign n, A arg) {
        scan(n.expr(), arg);
        return null;
    }

    @Override
    public Void visit(Stmt.DeclAssign n, A arg) {
        scan(n.expr(), arg);
        return null;
    }

    @Override
    public Void visit(Stmt.VarDecl n, A arg) {
        scan(n.initializer(), arg);
        return null;
    }

    @Override
    public Void visit(Stmt.Seq n, A arg) {
        Stmt current = n;
        while (current instanceof Stmt.Seq seq) {
            if (seq.first() instanceof Stmt.Seq) {
                scanNested(seq.first(), arg);
            } else {
                scan(seq.first(), arg);
            }
            current = seq.second();
        }
        scan(current, arg);
        return null;
    }

    @Override
    public Void visit(Stmt.Block n, A arg) {
        enter();
        try {
            for (Stmt stmt : n.statements()) {
                scan(stmt, arg);
            }
        } finally {
            exit();
        }
        return null;
    }

    @Override
    public Void visit(Stmt.If n, A arg) {
        enter();
        try {
            scan(n.init(), arg);
            scan(n.cond(), arg);
            scan(n.then(), arg);
            scan(n.otherwise(), arg);
        } finally {
            exit();
        }
        return null;
    }

    @Override
    public Void visit(Stmt.Return n, A arg) {
        scan(n.value(), arg);
        return null;
    }

    @Override
    public Void visit(Stmt.Break n, A arg) {
        return null;
    }

    @Override
    public Void visit(Stmt.Continue n, A arg) {
        return null;
    }

    @Override
    public Void visit(Stmt.Call n, A arg) {
        scan(n.call(), arg);
        return null;
    }

    @Override
    public Void visit(Stmt.Noop n, A arg) {
        return null;
    }

    // ── Expressions ──────────────────────────────────────────────────────

    @Override
    public Void visit(Expr.Literal n, A arg) {
        return null;
    }

    @Override
    public Void visit(Expr.Var n, A arg) {
        return null;
    }

    @Override
    public Void visit(Expr.Binary n, A arg) {
        scanNested(n.left(), arg);
        scanNested(n.right(), arg);
        return null;
    }

    @Override
    public Void visit(Expr.Unary n, A arg) {
        scanNested(n.operand(), arg);
        return null;
    }

    @Override
    public Void visit(Expr.Call n, A arg) {
        for (Expr a : n.args()) {
            scanNested(a, arg);
        }
        return null;
    }
}
