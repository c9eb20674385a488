package com.datapatch.parse;

import com.datapatch.ast.Coordinate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One node of the parse tree produced by the external patch grammar.
 *
 * <p>{@code rule} names the grammar alternative that matched. Tokens are leaves whose
 * {@code text} is the raw token text; rule nodes expose named sub-trees through {@code labels}
 * and unnamed ones, in source order, through {@code children}.</p>
 */
public record ParseNode(
    String rule,
    Coordinate coordinate,
    String text,
    Map<String, ParseNode> labels,
    List<ParseNode> children
) {

    public ParseNode {
        if (rule == null) {
            throw new IllegalArgumentException("Parse node without a rule");
        }
        if (coordinate == null) {
            coordinate = Coordinate.UNKNOWN;
        }
        labels = labels == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(labels));
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static ParseNode token(String rule, String text, Coordinate coordinate) {
        return new ParseNode(rule, coordinate, text, Map.of(), List.of());
    }

    public static Builder rule(String rule) {
        return new Builder(rule);
    }

    /**
     * @return the labeled sub-tree, or null when the label is absent
     */
    public ParseNode label(String name) {
        return labels.get(name);
    }

    public boolean hasLabel(String name) {
        return labels.containsKey(name);
    }

    public boolean hasText() {
        return text != null;
    }

    public static class Builder {
        private final String rule;
        private Coordinate coordinate = Coordinate.UNKNOWN;
        private String text;
        private final Map<String, ParseNode> labels = new LinkedHashMap<>();
        private final List<ParseNode> children = new ArrayList<>();

        private Builder(String rule) {
            this.rule = rule;
        }

        public Builder at(Coordinate coordinate) {
            this.coordinate = coordinate;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder label(String name, ParseNode node) {
            labels.put(name, node);
            return this;
        }

        public Builder child(ParseNode node) {
            children.add(node);
            return this;
        }

        public Builder children(List<ParseNode> nodes) {
            children.addAll(nodes);
            return this;
        }

        public ParseNode build() {
            return new ParseNode(rule, coordinate, text, labels, children);
        }
    }
}
