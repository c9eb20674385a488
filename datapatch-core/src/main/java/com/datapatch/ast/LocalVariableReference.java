package com.datapatch.ast;

/**
 * {@code $$name}: resolved starting at the innermost active scope.
 */
public record LocalVariableReference(
    Coordinate coordinate,
    String name
) implements Expression {

    @Override
    public String type() {
        return "LocalVariableReference";
    }
}
