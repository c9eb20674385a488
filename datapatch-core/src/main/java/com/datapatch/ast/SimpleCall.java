package com.datapatch.ast;

import java.util.List;

public record SimpleCall(
    Coordinate coordinate,
    String function,
    List<CallArgument> arguments
) implements Expression {

    public SimpleCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "SimpleCall";
    }
}
