package com.datapatch.ast;

/**
 * A field value such as {@code *2} that combines the field's current value with the operand.
 */
public record ImplicitExpression(
    Coordinate coordinate,
    BinaryOperator operator,
    Expression operand
) implements Expression {

    public ImplicitExpression {
        if (!operator.isImplicit()) {
            throw new IllegalArgumentException("Operator " + operator + " cannot be implicit");
        }
    }

    @Override
    public String type() {
        return "ImplicitExpression";
    }
}
