package com.datapatch.ast;

/**
 * {@code key[indexer]: value;} inside a selection block. The indexer may be null.
 */
public record Field(
    Coordinate coordinate,
    String key,
    Indexer indexer,
    Expression value
) implements Statement {

    @Override
    public String type() {
        return "Field";
    }
}
