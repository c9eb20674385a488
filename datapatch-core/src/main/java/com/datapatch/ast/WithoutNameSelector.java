package com.datapatch.ast;

public record WithoutNameSelector(
    Coordinate coordinate,
    String name
) implements Selector {

    @Override
    public String type() {
        return "WithoutNameSelector";
    }
}
