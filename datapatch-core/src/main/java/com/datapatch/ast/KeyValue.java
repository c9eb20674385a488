package com.datapatch.ast;

public record KeyValue(
    Coordinate coordinate,
    String key,
    Expression value
) implements Node {

    @Override
    public String type() {
        return "KeyValue";
    }
}
