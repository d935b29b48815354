package org.tlin.minilogic.ir;

import java.util.Optional;

import org.tlin.minilogic.value.Value;
import org.tlin.minilogic.value.Value.BoolValue;
import org.tlin.minilogic.value.Value.IntValue;
import org.tlin.minilogic.value.Value.StringValue;

/**
 * Concrete operator semantics shared by the evaluator and the constant folder.
 * An empty result means the operator does not apply to the operands (a symbolic operand,
 * a type mismatch, or division by zero).
 */
public final class Operators {

    private Operators() {}

    public static Optional<Value> applyBinary(BinaryOp op, Value left, Value right) {
        if (left.isSymbolic() || right.isSymbolic()) {
            return Optional.empty();
        }
        switch (op) {
            case EQ:
                return Optional.of(Value.of(left.equals(right)));
            case NEQ:
                return Optional.of(Value.of(!left.equals(right)));
            case ADD:
                if (left instanceof StringValue l && right instanceof StringValue r) {
                    return Optional.of(Value.of(l.value() + r.value()));
                }
                return arithmetic(op, left, right);
            case SUB:
            case MUL:
            case DIV:
            case MOD:
                return arithmetic(op, left, right);
            case LT:
            case LTE:
            case GT:
            case GTE:
                return comparison(op, left, right);
            case AND:
            case OR:
                if (left instanceof BoolValue l && right instanceof BoolValue r) {
                    boolean result = op == BinaryOp.AND ? l.value() && r.value() : l.value() || r.value();
                    return Optional.of(Value.of(result));
                }
                return Optional.empty();
            default:
                return Optional.empty();
        }
    }

    public static Optional<Value> applyUnary(UnaryOp op, Value operand) {
        if (op == UnaryOp.NOT && operand instanceof BoolValue b) {
            return Optional.of(Value.of(!b.value()));
        }
        if (op == UnaryOp.NEG && operand instanceof IntValue i) {
            return Optional.of(Value.of(-i.value()));
        }
        return Optional.empty();
    }

    private static Optional<Value> arithmetic(BinaryOp op, Value left, Value right) {
        if (!(left instanceof IntValue l) || !(right instanceof IntValue r)) {
            return Optional.empty();
        }
        long a = l.value();
        long b = r.value();
        switch (op) {
            case ADD:
                return Optional.of(Value.of(a + b));
            case SUB:
                return Optional.of(Value.of(a - b));
            case MUL:
                return Optional.of(Value.of(a * b));
            case DIV:
                return b == 0 ? Optional.empty() : Optional.of(Value.of(a / b));
            case MOD:
                return b == 0 ? Optional.empty() : Optional.of(Value.of(a % b));
            default:
                return Optional.empty();
        }
    }

    private static Optional<Value> comparison(BinaryOp op, Value left, Value right) {
        if (!(left instanceof IntValue l) || !(right instanceof IntValue r)) {
            return Optional.empty();
        }
        int cmp = Long.compare(l.value(), r.value());
        switch (op) {
            case LT:
                return Optional.of(Value.of(cmp < 0));
            case LTE:
                return Optional.of(Value.of(cmp <= 0));
            case GT:
                return Optional.of(Value.of(cmp > 0));
            case GTE:
                return Optional.of(Value.of(cmp >= 0));
            default:
                return Optional.empty();
        }
    }
}
