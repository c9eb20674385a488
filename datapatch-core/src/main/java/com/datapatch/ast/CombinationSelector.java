package com.datapatch.ast;

public record CombinationSelector(
    Coordinate coordinate,
    Selector lhs,
    Selector rhs
) implements Selector {

    @Override
    public String type() {
        return "CombinationSelector";
    }
}
