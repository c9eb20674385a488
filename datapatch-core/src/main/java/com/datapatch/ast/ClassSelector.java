package com.datapatch.ast;

public record ClassSelector(
    Coordinate coordinate,
    String className
) implements Selector {

    @Override
    public String type() {
        return "ClassSelector";
    }
}
