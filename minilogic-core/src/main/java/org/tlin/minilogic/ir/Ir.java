package org.tlin.minilogic.ir;

import java.util.Arrays;
import java.util.List;

import org.tlin.minilogic.value.Value;

/**
 * Builders mirroring each {@link Expr} and {@link Stmt} variant.
 */
public final class Ir {

    private static final Stmt.Noop NOOP = new Stmt.Noop();
    private static final Stmt.Break BREAK = new Stmt.Break();
    private static final Stmt.Continue CONTINUE = new Stmt.Continue();

    private Ir() {}

    // ── Expressions ──────────────────────────────────────────────────────

    public static Expr lit(Value value) {
        return new Expr.Literal(value);
    }

    public static Expr intLit(long value) {
        return new Expr.Literal(Value.of(value));
    }

    public static Expr boolLit(boolean value) {
        return new Expr.Literal(Value.of(value));
    }

    public static Expr strLit(String value) {
        return new Expr.Literal(Value.of(value));
    }

    public static Expr nilLit() {
        return new Expr.Literal(Value.nil());
    }

    public static Expr var(String name) {
        return new Expr.Var(name);
    }

    public static Expr binary(BinaryOp op, Expr left, Expr right) {
        return new Expr.Binary(op, left, right);
    }

    public static Expr unary(UnaryOp op, Expr operand) {
        return new Expr.Unary(op, operand);
    }

    public static Expr not(Expr operand) {
        return new Expr.Unary(UnaryOp.NOT, operand);
    }

    public static Expr neg(Expr operand) {
        return new Expr.Unary(UnaryOp.NEG, operand);
    }

    public static Expr and(Expr left, Expr right) {
        return new Expr.Binary(BinaryOp.AND, left, right);
    }

    public static Expr or(Expr left, Expr right) {
        return new Expr.Binary(BinaryOp.OR, left, right);
    }

    public static Expr eq(Expr left, Expr right) {
        return new Expr.Binary(BinaryOp.EQ, left, right);
    }

    public static Expr neq(Expr left, Expr right) {
        return new Expr.Binary(BinaryOp.NEQ, left, right);
    }

    public static Expr add(Expr left, Expr right) {
        return new Expr.Binary(BinaryOp.ADD, left, right);
    }

    public static Expr lt(Expr left, Expr right) {
        return new Expr.Binary(BinaryOp.LT, left, right);
    }

    public static Expr gt(Expr left, Expr right) {
        return new Expr.Binary(BinaryOp.GT, left, right);
    }

    public static Expr.Call call(String function, Expr... args) {
        return new Expr.Call(function, Arrays.asList(args));
    }

    // ── Statements ───────────────────────────────────────────────────────

    public static Stmt assign(String name, Expr expr) {
        return new Stmt.Assign(name, expr);
    }

    public static Stmt declAssign(String name, Expr expr) {
        return new Stmt.DeclAssign(List.of(name), expr);
    }

    public static Stmt declAssign(List<String> names, Expr expr) {
        return new Stmt.DeclAssign(names, expr);
    }

    public static Stmt varDecl(String name) {
        return new Stmt.VarDecl(name, null);
    }

    public static Stmt varDecl(String name, Expr initializer) {
        return new Stmt.VarDecl(name, initializer);
    }

    /**
     * Right-nested sequence of the given statements; no statements yields a no-op and a
     * single statement is returned as-is.
     */
    public static Stmt seq(Stmt... stmts) {
        return seq(Arrays.asList(stmts));
    }

    public static Stmt seq(List<Stmt> stmts) {
        if (stmts.isEmpty()) {
            return NOOP;
        }
        Stmt result = stmts.get(stmts.size() - 1);
        for (int i = stmts.size() - 2; i >= 0; i--) {
            result = new Stmt.Seq(stmts.get(i), result);
        }
        return result;
    }

    public static Stmt block(Stmt... stmts) {
        return new Stmt.Block(Arrays.asList(stmts));
    }

    public static Stmt block(List<Stmt> stmts) {
        return new Stmt.Block(stmts);
    }

    public static Stmt ifThen(Expr cond, Stmt then) {
        return new Stmt.If(null, cond, then, null);
    }

    /**
     * {@code otherwise} may be {@code null} for an if without else.
     */
    public static Stmt ifElse(Expr cond, Stmt then, Stmt otherwise) {
        return new Stmt.If(null, cond, then, otherwise);
    }

    public static Stmt ifInit(Stmt init, Expr cond, Stmt then, Stmt otherwise) {
        return new Stmt.If(init, cond, then, otherwise);
    }

    public static Stmt ret(Expr value) {
        return new Stmt.Return(value);
    }

    public static Stmt retVoid() {
        return new Stmt.Return(null);
    }

    public static Stmt breakLoop() {
        return BREAK;
    }

    public static Stmt continueLoop() {
        return CONTINUE;
    }

    public static Stmt callStmt(String function, Expr... args) {
        return new Stmt.Call(call(function, args));
    }

    public static Stmt noop() {
        return NOOP;
    }

    // ── Queries ──────────────────────────────────────────────────────────

    /**
     * @throws org.tlin.minilogic.NestingDepthExceededException when {@code expr} nests deeper
     *         than {@link IrScanner#DEFAULT_MAX_DEPTH}
     */
    public static boolean containsCall(Expr expr) {
        CallFinder finder = new CallFinder();
        finder.scan(expr, null);
        return finder.found;
    }

    public static boolean containsCall(Stmt stmt) {
        CallFinder finder = new CallFinder();
        finder.scan(stmt, null);
        return finder.found;
    }

    /**
     * Names a statement declares in its own frame: the targets of a short declaration or
     * a {@code var} declaration. Used to find the variables an {@code if} initializer scopes.
     */
    public static List<String> declaredNames(Stmt stmt) {
        if (stmt instanceof Stmt.DeclAssign d) {
            return d.names();
        }
        if (stmt instanceof Stmt.VarDecl d) {
            return List.of(d.name());
        }
        return List.of();
    }

    private static final class CallFinder extends IrScanner<Void> {
        boolean found;

        @Override
        public Void visit(Expr.Call n, Void arg) {
            found = true;
            return null;
        }
    }
}
