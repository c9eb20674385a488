package com.datapatch.ast;

public record Return(
    Coordinate coordinate,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "Return";
    }
}
