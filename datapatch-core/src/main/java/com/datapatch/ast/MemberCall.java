package com.datapatch.ast;

import java.util.List;

/**
 * {@code receiver.function(arguments)}, evaluated as {@code function(receiver, arguments)}.
 */
public record MemberCall(
    Coordinate coordinate,
    Expression receiver,
    String function,
    List<CallArgument> arguments
) implements Expression {

    public MemberCall {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "MemberCall";
    }
}
