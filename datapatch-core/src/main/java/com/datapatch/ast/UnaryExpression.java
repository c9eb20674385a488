package com.datapatch.ast;

public record UnaryExpression(
    Coordinate coordinate,
    UnaryOperator operator,
    Expression operand
) implements Expression {

    @Override
    public String type() {
        return "UnaryExpression";
    }
}
