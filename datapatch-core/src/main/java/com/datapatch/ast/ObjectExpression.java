package com.datapatch.ast;

import java.util.List;

public record ObjectExpression(
    Coordinate coordinate,
    List<KeyValue> entries
) implements Expression {

    public ObjectExpression {
        entries = List.copyOf(entries);
    }

    @Override
    public String type() {
        return "ObjectExpression";
    }
}
