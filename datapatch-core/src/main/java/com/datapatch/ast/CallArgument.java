package com.datapatch.ast;

/**
 * A value passed at a call site, positionally ({@code name == null}) or by name.
 */
public record CallArgument(
    Coordinate coordinate,
    String name,
    Expression value
) implements Node {

    public CallArgument(Coordinate coordinate, Expression value) {
        this(coordinate, null, value);
    }

    public boolean hasName() {
        return name != null;
    }

    @Override
    public String type() {
        return "CallArgument";
    }
}
