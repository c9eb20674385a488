package com.datapatch.ast;

import java.util.List;

/**
 * {@code for $index from .. to ..} (end excluded) or {@code through} (end included).
 */
public record For(
    Coordinate coordinate,
    String index,
    Expression from,
    boolean inclusive,
    Expression to,
    List<Statement> body
) implements Statement {

    public For {
        body = List.copyOf(body);
    }

    @Override
    public String type() {
        return "For";
    }
}
