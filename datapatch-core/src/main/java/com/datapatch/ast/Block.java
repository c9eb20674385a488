package com.datapatch.ast;

import java.util.List;

public record Block(
    Coordinate coordinate,
    List<Statement> body
) implements Statement {

    public Block {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Block";
    }
}
