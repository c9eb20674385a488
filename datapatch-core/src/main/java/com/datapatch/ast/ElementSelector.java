package com.datapatch.ast;

public record ElementSelector(
    Coordinate coordinate,
    String elementType
) implements Selector {

    @Override
    public String type() {
        return "ElementSelector";
    }
}
