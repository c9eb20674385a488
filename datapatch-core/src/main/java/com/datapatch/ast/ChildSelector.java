package com.datapatch.ast;

/**
 * Matches elements matching {@code child} that have an ancestor matching {@code parent}.
 * When {@code child} is an {@link ElementAdditionSelector} a new child is created under every
 * element matching {@code parent} instead.
 */
public record ChildSelector(
    Coordinate coordinate,
    Selector parent,
    Selector child
) implements Selector {

    @Override
    public String type() {
        return "ChildSelector";
    }
}
