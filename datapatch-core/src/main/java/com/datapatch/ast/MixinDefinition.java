package com.datapatch.ast;

import java.util.List;

/**
 * Reusable, parameterized list of selection-level statements.
 */
public record MixinDefinition(
    Coordinate coordinate,
    String name,
    List<Argument> arguments,
    List<Statement> body
) implements Statement {

    public MixinDefinition {
        arguments = List.copyOf(arguments);
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "MixinDefinition";
    }
}
