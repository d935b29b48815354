package org.tlin.minilogic.ir;

import java.util.Map;
import java.util.Optional;

public enum BinaryOp {

    ADD("+"),
    SUB("-"),
    MUL("*"),
    DIV("/"),
    MOD("%"),
    EQ("=="),
    NEQ("!="),
    LT("<"),
    LTE("<="),
    GT(">"),
    GTE(">="),
    AND("&&"),
    OR("||");

    private static final Map<String, BinaryOp> BY_SYMBOL = Map.ofEntries(
            Map.entry("+", ADD),
            Map.entry("-", SUB),
            Map.entry("*", MUL),
            Map.entry("/", DIV),
            Map.entry("%", MOD),
            Map.entry("==", EQ),
            Map.entry("!=", NEQ),
            Map.entry("<", LT),
            Map.entry("<=", LTE),
            Map.entry(">", GT),
            Map.entry(">=", GTE),
            Map.entry("&&", AND),
            Map.entry("||", OR)
    );

    private final String symbol;

    BinaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isLogical() {
        return this == AND || this == OR;
    }

    public static Optional<BinaryOp> fromSymbol(String symbol) {
        return Optional.ofNullable(BY_SYMBOL.get(symbol));
    }
}
