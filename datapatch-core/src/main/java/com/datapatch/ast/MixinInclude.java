package com.datapatch.ast;

import java.util.List;

public record MixinInclude(
    Coordinate coordinate,
    String mixin,
    List<CallArgument> arguments
) implements Statement {

    public MixinInclude {
        arguments = List.copyOf(arguments);
    }

    @Override
    public String type() {
        return "MixinInclude";
    }
}
