package com.datapatch.ast;

/**
 * Placeholder left where a parse-tree node could not be transformed. It can stand in for any
 * statement, expression, selector, indexer or attribute so the surrounding tree stays well typed.
 */
public record ErrorNode(
    Coordinate coordinate,
    String message
) implements Statement, Expression, Selector, Indexer, Attribute {

    @Override
    public String type() {
        return "ErrorNode";
    }
}
