package com.datapatch.ast;

import java.util.List;

public record Patch(
    Coordinate coordinate,
    List<Statement> statements
) implements Node {

    public Patch {
        statements = List.copyOf(statements);
    }

    public Patch(List<Statement> statements) {
        this(Coordinate.UNKNOWN, statements);
    }

    @Override
    public String type() {
        return "Patch";
    }
}
