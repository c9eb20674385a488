package com.datapatch.ast;

/**
 * A named stage with an unsigned 64-bit priority. Ordering stages is left to the host.
 */
public record StageDefinition(
    Coordinate coordinate,
    String stage,
    long priority
) implements Statement {

    @Override
    public String type() {
        return "StageDefinition";
    }

    public String priorityText() {
        return Long.toUnsignedString(priority);
    }
}
