package org.tlin.minilogic.ir;

import java.util.List;
import java.util.Objects;

import org.tlin.minilogic.printer.IrPrinter;
import org.tlin.minilogic.value.Value;

/**
 * Expression node. Evaluating an expression never mutates state and always terminates.
 */
public sealed interface Expr {

    <R, A> R accept(ExprVisitor<R, A> v, A arg);

    record Literal(Value value) implements Expr {
        public Literal {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public <R, A> R accept(ExprVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    record Var(String name) implements Expr {
        public Var {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public <R, A> R accept(ExprVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    record Binary(BinaryOp op, Expr left, Expr right) implements Expr {
        public Binary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public <R, A> R accept(ExprVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    record Unary(UnaryOp op, Expr operand) implements Expr {
        public Unary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public <R, A> R accept(ExprVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }

    /**
     * Opaque function call. Only its name, argument values and position in the call
     * sequence are observable.
     */
    record Call(String function, List<Expr> args) implements Expr {
        public Call {
            Objects.requireNonNull(function, "function");
            args = List.copyOf(args);
        }

        @Override
        public <R, A> R accept(ExprVisitor<R, A> v, A arg) {
            return v.visit(this, arg);
        }

        @Override
        public String toString() {
            return IrPrinter.print(this);
        }
    }
}
