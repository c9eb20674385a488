package com.datapatch.ast;

public record NameSelector(
    Coordinate coordinate,
    String name
) implements Selector {

    @Override
    public String type() {
        return "NameSelector";
    }
}
