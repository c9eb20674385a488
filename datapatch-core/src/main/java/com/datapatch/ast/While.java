package com.datapatch.ast;

import java.util.List;

public record While(
    Coordinate coordinate,
    Expression condition,
    List<Statement> body
) implements Statement {

    public While {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "While";
    }
}
