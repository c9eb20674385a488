package com.datapatch.ast;

/**
 * A named selector macro, expanded through the ruleset registry.
 */
public record RulesetSelector(
    Coordinate coordinate,
    String ruleset
) implements Selector {

    @Override
    public String type() {
        return "RulesetSelector";
    }
}
