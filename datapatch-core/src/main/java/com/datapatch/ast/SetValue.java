package com.datapatch.ast;

public record SetValue(
    Coordinate coordinate,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "SetValue";
    }
}
