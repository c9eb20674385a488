package com.datapatch.ast;

import java.util.List;

public record SelectionBlock(
    Coordinate coordinate,
    List<Attribute> attributes,
    Selector selector,
    List<Statement> body
) implements Statement {

    public SelectionBlock {
        attributes = List.copyOf(attributes);
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "SelectionBlock";
    }
}
