package com.datapatch.ast;

public record RequireNotModAttribute(
    Coordinate coordinate,
    String mod
) implements Attribute {

    @Override
    public String type() {
        return "RequireNotModAttribute";
    }
}
