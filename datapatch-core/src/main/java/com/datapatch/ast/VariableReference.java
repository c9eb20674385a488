package com.datapatch.ast;

/**
 * {@code $name}: resolved starting at the patch-global scope.
 */
public record VariableReference(
    Coordinate coordinate,
    String name
) implements Expression {

    @Override
    public String type() {
        return "VariableReference";
    }
}
