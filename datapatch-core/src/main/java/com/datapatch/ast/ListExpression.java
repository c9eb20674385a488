package com.datapatch.ast;

import java.util.List;

public record ListExpression(
    Coordinate coordinate,
    List<Expression> items
) implements Expression {

    public ListExpression {
        items = List.copyOf(items);
    }

    @Override
    public String type() {
        return "ListExpression";
    }
}
