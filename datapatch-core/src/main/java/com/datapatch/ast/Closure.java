package com.datapatch.ast;

import java.util.List;

/**
 * Anonymous function. Only usable as a call argument; closures are not data values.
 */
public record Closure(
    Coordinate coordinate,
    List<Argument> arguments,
    List<Statement> body
) implements Expression {

    public Closure {
        arguments = List.copyOf(arguments);
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Closure";
    }
}
