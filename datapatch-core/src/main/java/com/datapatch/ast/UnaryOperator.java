package com.datapatch.ast;

public enum UnaryOperator {
    POSITIVE("+"),
    NEGATE("-"),
    NOT("not");

    private final String symbol;

    UnaryOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
