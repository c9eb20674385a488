package com.datapatch.ast;

import java.util.List;

/**
 * One link of an if / else-if / else chain. {@code otherwise} is another {@link Conditional}
 * for an else-if, a {@link Block} for the terminal else, or null.
 */
public record Conditional(
    Coordinate coordinate,
    Expression condition,
    List<Statement> body,
    Statement otherwise
) implements Statement {

    public Conditional {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Conditional";
    }
}
