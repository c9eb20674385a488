package com.datapatch.ast;

public record Ternary(
    Coordinate coordinate,
    Expression condition,
    Expression whenTrue,
    Expression whenFalse
) implements Expression {

    @Override
    public String type() {
        return "Ternary";
    }
}
