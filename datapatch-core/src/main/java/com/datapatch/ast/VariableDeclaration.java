package com.datapatch.ast;

public record VariableDeclaration(
    Coordinate coordinate,
    String name,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
