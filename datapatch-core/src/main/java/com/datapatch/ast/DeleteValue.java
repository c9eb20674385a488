package com.datapatch.ast;

public record DeleteValue(
    Coordinate coordinate
) implements Statement {

    @Override
    public String type() {
        return "DeleteValue";
    }
}
