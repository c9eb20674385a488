package com.datapatch.ast;

public record WithoutClassSelector(
    Coordinate coordinate,
    String className
) implements Selector {

    @Override
    public String type() {
        return "WithoutClassSelector";
    }
}
