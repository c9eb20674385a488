package com.datapatch.ast;

public record Subscript(
    Coordinate coordinate,
    Expression target,
    Expression index
) implements Expression {

    @Override
    public String type() {
        return "Subscript";
    }
}
