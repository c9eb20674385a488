package com.datapatch.ast;

public record BinaryExpression(
    Coordinate coordinate,
    BinaryOperator operator,
    Expression lhs,
    Expression rhs
) implements Expression {

    @Override
    public String type() {
        return "BinaryExpression";
    }
}
