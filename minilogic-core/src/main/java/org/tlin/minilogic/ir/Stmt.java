package org.tlin.minilogic.ir;

import java.util.List;
import java.util.Objects;

import org.tlin.minilogic.printer.IrPrinter;

/**
 * Statement node. Optional children ({@code If.init}, {@code If.otherwise},
 * {@code VarDecl.initializer}, {@code Return.value}) are {@code null} when absent.
 */
public sealed interface Stmt {

    <R, A> R accept(StmtVisitor<R, A> v, A arg);

    /**
     * {@code name = expr}
     */
    record Assign(String name, Expr expr) implements Stmt {
        public Assign {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(expr, "expr");
        }

        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    /**
     * Short declaration {@code a, b := expr}. With more than one name every variable is
     * bound to a component of the (opaque) tuple the expression produces.
     */
    record DeclAssign(List<String> names, Expr expr) implements Stmt {
        public DeclAssign {
            names = List.copyOf(names);
            if (names.isEmpty()) {
                throw new IllegalArgumentException("DeclAssign needs at least one variable");
            }
            Objects.requireNonNull(expr, "expr");
        }

        public boolean isMulti() {
            return names.size() > 1;
        }

        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    /**
     * {@code var name [= initializer]}
     */
    record VarDecl(String name, Expr initializer) implements Stmt {
        public VarDecl {
            Objects.requireNonNull(name, "name");
        }

        public boolean hasInitializer() {
            return initializer != null;
        }

        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    /**
     * {@code first; second}. Equality and hashing walk the right-nested spine iteratively,
     * so long sequences compare without deep recursion.
     */
    record Seq(Stmt first, Stmt second) implements Stmt {
        public Seq {
            Objects.requireNonNull(first, "first");
            Objects.requireNonNull(second, "second");
        }

        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public boolean equals(Object o) {
            Object left = this;
            Object right = o;
            while (left instanceof Seq a && right instanceof Seq b) {
                if (a == b) {
                    return true;
                }
                if (!a.first.equals(b.first)) {
                    return false;
                }
                left = a.second;
                right = b.second;
            }
            if (left instanceof Seq || right instanceof Seq) {
                return false;
            }
            return left.equals(right);
        }

        @Override
        public int hashCode() {
            int hash = 1;
            Stmt current = this;
            while (current instanceof Seq seq) {
                hash = 31 * hash + seq.first.hashCode();
                current = seq.second;
            }
            return 31 * hash + current.hashCode();
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    record Block(List<Stmt> statements) implements Stmt {
        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    /**
     * {@code if [init;] cond { then } [else { otherwise }]}. Variables declared by
     * {@code init} are visible in {@code cond} and both branches only.
     */
    record If(Stmt init, Expr cond, Stmt then, Stmt otherwise) implements Stmt {
        public If {
            Objects.requireNonNull(cond, "cond");
            Objects.requireNonNull(then, "then");
        }

        public boolean hasInit() {
            return init != null;
        }

        public boolean hasElse() {
            return otherwise != null;
        }

        public If withoutElse() {
            return new If(init, cond, then, null);
        }

        public If withElse(Stmt otherwise) {
            return new If(init, cond, then, otherwise);
        }

        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    record Return(Expr value) implements Stmt {

        public boolean hasValue() {
            return value != null;
        }

        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    record Break() implements Stmt {
        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return "break";
        }
    }

    record Continue() implements Stmt {
        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return "continue";
        }
    }

    /**
     * A call evaluated for its side effect only.
     */
    record Call(Expr.Call call) implements Stmt {
        public Call {
            Objects.requireNonNull(call, "call");
        }

        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    record Noop() implements Stmt {
        @Override
        public <R, A> R accept(StmtVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return "noop";
        }
    }
}
