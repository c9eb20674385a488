package com.datapatch.ast;

/**
 * Not a predicate: selecting it creates a new element of the given type.
 */
public record ElementAdditionSelector(
    Coordinate coordinate,
    String elementType
) implements Selector {

    @Override
    public String type() {
        return "ElementAdditionSelector";
    }
}
