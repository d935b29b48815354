package org.tlin.minilogic.javaparser;

import java.util.Map;
import java.util.Optional;

import com.github.javaparser.ast.expr.AssignExpr;
import com.github.javaparser.ast.expr.BinaryExpr;
import com.github.javaparser.ast.expr.UnaryExpr;
import org.tlin.minilogic.ir.BinaryOp;
import org.tlin.minilogic.ir.UnaryOp;

/**
 * Maps JavaParser operators onto the IR operator set. Operators without an IR counterpart
 * (bitwise, shifts, increments) map to empty.
 */
final class JavaOperators {

    private static final Map<BinaryExpr.Operator, BinaryOp> BINARY_MAP = Map.ofEntries(
            Map.entry(BinaryExpr.Operator.PLUS, BinaryOp.ADD),
            Map.entry(BinaryExpr.Operator.MINUS, BinaryOp.SUB),
            Map.entry(BinaryExpr.Operator.MULTIPLY, BinaryOp.MUL),
            Map.entry(BinaryExpr.Operator.DIVIDE, BinaryOp.DIV),
            Map.entry(BinaryExpr.Operator.REMAINDER, BinaryOp.MOD),
            Map.entry(BinaryExpr.Operator.EQUALS, BinaryOp.EQ),
            Map.entry(BinaryExpr.Operator.NOT_EQUALS, BinaryOp.NEQ),
            Map.entry(BinaryExpr.Operator.LESS, BinaryOp.LT),
            Map.entry(BinaryExpr.Operator.LESS_EQUALS, BinaryOp.LTE),
            Map.entry(BinaryExpr.Operator.GREATER, BinaryOp.GT),
            Map.entry(BinaryExpr.Operator.GREATER_EQUALS, BinaryOp.GTE),
            Map.entry(BinaryExpr.Operator.AND, BinaryOp.AND),
            Map.entry(BinaryExpr.Operator.OR, BinaryOp.OR)
    );

    private static final Map<AssignExpr.Operator, BinaryOp> COMPOUND_MAP = Map.of(
            AssignExpr.Operator.PLUS, BinaryOp.ADD,
            AssignExpr.Operator.MINUS, BinaryOp.SUB,
            AssignExpr.Operator.MULTIPLY, BinaryOp.MUL,
            AssignExpr.Operator.DIVIDE, BinaryOp.DIV,
            AssignExpr.Operator.REMAINDER, BinaryOp.MOD
    );

    private JavaOperators() {}

    static Optional<BinaryOp> binary(BinaryExpr.Operator operator) {
        return Optional.ofNullable(BINARY_MAP.get(operator));
    }

    /**
     * The arithmetic behind a compound assignment such as {@code +=}.
     */
    static Optional<BinaryOp> compound(AssignExpr.Operator operator) {
        return Optional.ofNullable(COMPOUND_MAP.get(operator));
    }

    static Optional<UnaryOp> unary(UnaryExpr.Operator operator) {
        switch (operator) {
            case LOGICAL_COMPLEMENT:
                return Optional.of(UnaryOp.NOT);
            case MINUS:
                return Optional.of(UnaryOp.NEG);
            default:
                return Optional.empty();
        }
    }
}
