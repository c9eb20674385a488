package com.datapatch.ast;

import java.util.List;

public record FunctionDefinition(
    Coordinate coordinate,
    String name,
    List<Argument> arguments,
    List<Statement> body
) implements Statement {

    public FunctionDefinition {
        arguments = List.copyOf(arguments);
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "FunctionDefinition";
    }
}
