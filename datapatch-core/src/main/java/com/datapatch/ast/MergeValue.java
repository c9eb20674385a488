package com.datapatch.ast;

public record MergeValue(
    Coordinate coordinate,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "MergeValue";
    }
}
