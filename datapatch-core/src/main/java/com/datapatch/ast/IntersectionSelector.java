package com.datapatch.ast;

public record IntersectionSelector(
    Coordinate coordinate,
    Selector lhs,
    Selector rhs
) implements Selector {

    @Override
    public String type() {
        return "IntersectionSelector";
    }
}
