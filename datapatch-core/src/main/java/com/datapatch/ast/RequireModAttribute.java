package com.datapatch.ast;

public record RequireModAttribute(
    Coordinate coordinate,
    String mod
) implements Attribute {

    @Override
    public String type() {
        return "RequireModAttribute";
    }
}
