package com.datapatch.ast;

public record Import(
    Coordinate coordinate,
    String library
) implements Statement {

    @Override
    public String type() {
        return "Import";
    }
}
