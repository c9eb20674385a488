package com.datapatch.ast;

public record WildcardSelector(
    Coordinate coordinate
) implements Selector {

    @Override
    public String type() {
        return "WildcardSelector";
    }
}
