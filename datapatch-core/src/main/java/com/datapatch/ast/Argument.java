package com.datapatch.ast;

/**
 * A declared parameter of a function, closure or mixin. {@code defaultValue} may be null.
 */
public record Argument(
    Coordinate coordinate,
    String name,
    Expression defaultValue
) implements Node {

    public Argument(Coordinate coordinate, String name) {
        this(coordinate, name, null);
    }

    public boolean hasDefault() {
        return defaultValue != null;
    }

    @Override
    public String type() {
        return "Argument";
    }
}
