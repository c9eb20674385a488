package com.datapatch.ast;

import java.util.List;

/**
 * @param key bound to the list index or object key, may be null
 */
public record Each(
    Coordinate coordinate,
    String key,
    String value,
    Expression iterable,
    List<Statement> body
) implements Statement {

    public Each {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "Each";
    }
}
