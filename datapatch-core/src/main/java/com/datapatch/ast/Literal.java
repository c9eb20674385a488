package com.datapatch.ast;

import com.datapatch.value.DataValue;

public record Literal(
    Coordinate coordinate,
    DataValue value
) implements Expression {

    @Override
    public String type() {
        return "Literal";
    }
}
