package org.tlin.minilogic.ir;

public enum UnaryOp {

    NOT("!"),
    NEG("-");

    private final String symbol;

    UnaryOp(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
