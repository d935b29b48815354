package org.tlin.minilogic.printer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import org.tlin.minilogic.ir.Expr;
import org.tlin.minilogic.ir.ExprVisitor;
import org.tlin.minilogic.ir.Stmt;
import org.tlin.minilogic.ir.StmtVisitor;

/**
 * Renders IR back to source-like text, either on one line ({@link #print}) or indented
 * one statement per line ({@link #prettyPrint}).
 * <p>
 * Subtrees nested deeper than the depth limit are printed as {@code ...}; sequences count
 * as flat however they are associated.
 */
public class IrPrinter implements StmtVisitor<Void, Integer>, ExprVisitor<Void, Void> {

    public static final int DEFAULT_MAX_DEPTH = 1024;

    private static final String INDENT = "    ";
    private static final String ELIDED = "...";

    private final StringBuilder out = new StringBuilder();
    private final boolean pretty;
    private final int maxDepth;
    private int depth;

    private IrPrinter(boolean pretty, int maxDepth) {
        this.pretty = pretty;
        this.maxDepth = maxDepth;
    }

    public static String print(Expr expr) {
        return print(expr, DEFAULT_MAX_DEPTH);
    }

    public static String print(Expr expr, int maxDepth) {
        IrPrinter printer = new IrPrinter(false, maxDepth);
        expr.accept(printer, null);
        return printer.out.toString();
    }

    public static String print(Stmt stmt) {
        IrPrinter printer = new IrPrinter(false, DEFAULT_MAX_DEPTH);
        stmt.accept(printer, 0);
        return printer.out.toString();
    }

    public static String prettyPrint(Stmt stmt) {
        IrPrinter printer = new IrPrinter(true, DEFAULT_MAX_DEPTH);
        printer.statement(stmt, 0);
        return printer.out.toString().stripTrailing();
    }

    /**
     * Enter one nesting level, or print the elision marker and return false when the
     * limit is reached. Every successful call is paired with {@code depth--}.
     */
    private boolean enter() {
        if (depth >= maxDepth) {
            out.append(ELIDED);
            return false;
        }
        depth++;
        return true;
    }

    // ── Statements ───────────────────────────────────────────────────────

    private void statement(Stmt stmt, int level) {
        if (pretty && !(stmt instanceof Stmt.Seq) && !(stmt instanceof Stmt.Block)) {
            out.append(INDENT.repeat(level));
            stmt.accept(this, level);
            out.append('\n');
        } else {
            stmt.accept(this, level);
        }
    }

    private void body(Stmt stmt, int level) {
        if (pretty) {
            out.append("{\n");
            for (Stmt s : flatten(stmt)) {
                statement(s, level + 1);
            }
            out.append(INDENT.repeat(level)).append('}');
        } else {
            out.append("{ ");
            stmt.accept(this, level);
            out.append(" }");
        }
    }

    private static List<Stmt> flatten(Stmt stmt) {
        if (stmt instanceof Stmt.Block b) {
            return b.statements();
        }
        List<Stmt> result = new ArrayList<>();
        Deque<Stmt> pending = new ArrayDeque<>();
        pending.push(stmt);
        while (!pending.isEmpty()) {
            Stmt current = pending.pop();
            if (current instanceof Stmt.Seq seq) {
                pending.push(seq.second());
                pending.push(seq.first());
            } else {
                result.add(current);
            }
        }
        return result;
    }

    @Override
    public Void visit(Stmt.Assign n, Integer level) {
        out.append(n.name()).append(" = ");
        n.expr().accept(this, null);
        return null;
    }

    @Override
    public Void visit(Stmt.DeclAssign n, Integer level) {
        out.append(String.join(", ", n.names())).append(" := ");
        n.expr().accept(this, null);
        return null;
    }

    @Override
    public Void visit(Stmt.VarDecl n, Integer level) {
        out.append("var ").append(n.name());
        if (n.hasInitializer()) {
            out.append(" = ");
            n.initializer().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visit(Stmt.Seq n, Integer level) {
        if (pretty) {
            for (Stmt s : flatten(n)) {
                statement(s, level);
            }
            return null;
        }
        List<Stmt> parts = flatten(n);
        for (int i = 0; i < parts.size(); i++) {
            if (i > 0) {
                out.append("; ");
            }
            parts.get(i).accept(this, level);
        }
        return null;
    }

    @Override
    public Void visit(Stmt.Block n, Integer level) {
        if (!enter()) {
            return null;
        }
        try {
            return block(n, level);
        } finally {
            depth--;
        }
    }

    private Void block(Stmt.Block n, Integer level) {
        if (pretty) {
            for (Stmt s : n.statements()) {
                statement(s, level);
            }
            return null;
        }
        if (n.statements().isEmpty()) {
            out.append("{}");
            return null;
        }
        out.append("{ ");
        for (int i = 0; i < n.statements().size(); i++) {
            if (i > 0) {
                out.append("; ");
            }
            n.statements().get(i).accept(this, level);
        }
        out.append(" }");
        return null;
    }

    @Override
    public Void visit(Stmt.If n, Integer level) {
        if (!enter()) {
            return null;
        }
        try {
            return conditional(n, level);
        } finally {
            depth--;
        }
    }

    private Void conditional(Stmt.If n, Integer level) {
        out.append("if ");
        if (n.hasInit()) {
            n.init().accept(this, level);
            out.append("; ");
        }
        n.cond().accept(this, null);
        out.append(' ');
        body(n.then(), level);
        if (n.hasElse()) {
            out.append(" else ");
            if (n.otherwise() instanceof Stmt.If) {
                n.otherwise().accept(this, level);
            } else {
                body(n.otherwise(), level);
            }
        }
        return null;
    }

    @Override
    public Void visit(Stmt.Return n, Integer level) {
        out.append("return");
        if (n.hasValue()) {
            out.append(' ');
            n.value().accept(this, null);
        }
        return null;
    }

    @Override
    public Void visit(Stmt.Break n, Integer level) {
        out.append("break");
        return null;
    }

    @Override
    public Void visit(Stmt.Continue n, Integer level) {
        out.append("continue");
        return null;
    }

    @Override
    public Void visit(Stmt.Call n, Integer level) {
        n.call().accept(this, null);
        return null;
    }

    @Override
    public Void visit(Stmt.Noop n, Integer level) {
        out.append("noop");
        return null;
    }

    // ── Expressions ──────────────────────────────────────────────────────

    @Override
    public Void visit(Expr.Literal n, Void arg) {
        out.append(n.value().render());
        return null;
    }

    @Override
    public Void visit(Expr.Var n, Void arg) {
        out.append(n.name());
        return null;
    }

    @Override
    public Void visit(Expr.Binary n, Void arg) {
        if (!enter()) {
            return null;
        }
        out.append('(');
        n.left().accept(this, null);
        out.append(' ').append(n.op().symbol()).append(' ');
        n.right().accept(this, null);
        out.append(')');
        depth--;
        return null;
    }

    @Override
    public Void visit(Expr.Unary n, Void arg) {
        if (!enter()) {
            return null;
        }
        out.append('(').append(n.op().symbol());
        n.operand().accept(this, null);
        out.append(')');
        depth--;
        return null;
    }

    @Override
    public Void visit(Expr.Call n, Void arg) {
        if (!enter()) {
            return null;
        }
        out.append(n.function()).append('(');
        for (int i = 0; i < n.args().size(); i++) {
            if (i > 0) {
                out.append(", ");
            }
            n.args().get(i).accept(this, null);
        }
        out.append(')');
        depth--;
        return null;
    }
}
