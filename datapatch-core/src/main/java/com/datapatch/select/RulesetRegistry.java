package com.datapatch.select;

import com.datapatch.ast.ChildSelector;
import com.datapatch.ast.CombinationSelector;
import com.datapatch.ast.IntersectionSelector;
import com.datapatch.ast.RulesetSelector;
import com.datapatch.ast.Selector;
import com.datapatch.diagnostics.ResolutionException;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named selector macros for one compilation unit. References are expanded lazily and the
 * expansion is cached; cyclic definitions are reported when first expanded.
 */
public class RulesetRegistry {

    private final Map<String, Selector> rulesets;
    private final Map<String, Selector> expanded = new ConcurrentHashMap<>();

    public RulesetRegistry(Map<String, Selector> rulesets) {
        this.rulesets = Map.copyOf(rulesets);
    }

    public static RulesetRegistry empty() {
        return new RulesetRegistry(Map.of());
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String name) {
        return rulesets.containsKey(name);
    }

    /**
     * Resolves a ruleset reference to a selector that contains no further references.
     *
     * @throws ResolutionException if the ruleset is unknown or refers back to itself
     */
    public Selector expand(RulesetSelector reference) {
        return expand(reference, new ArrayDeque<>());
    }

    private Selector expand(RulesetSelector reference, Deque<String> expanding) {
        Selector cached = expanded.get(reference.ruleset());
        if (cached != null) {
            return cached;
        }
        Selector definition = rulesets.get(reference.ruleset());
        if (definition == null) {
            throw new ResolutionException(reference.coordinate(), "Unknown ruleset '" + reference.ruleset() + "'");
        }
        if (expanding.contains(reference.ruleset())) {
            throw new ResolutionException(reference.coordinate(),
                "Ruleset '" + reference.ruleset() + "' is defined in terms of itself");
        }
        expanding.push(reference.ruleset());
        Selector result;
        try {
            result = inline(definition, expanding);
        } finally {
            expanding.pop();
        }
        Selector previous = expanded.putIfAbsent(reference.ruleset(), result);
        return previous != null ? previous : result;
    }

    private Selector inline(Selector selector, Deque<String> expanding) {
        if (selector instanceof RulesetSelector reference) {
            return expand(reference, expanding);
        }
        if (selector instanceof ChildSelector child) {
            return new ChildSelector(child.coordinate(), inline(child.parent(), expanding), inline(child.child(), expanding));
        }
        if (selector instanceof IntersectionSelector both) {
            return new IntersectionSelector(both.coordinate(), inline(both.lhs(), expanding), inline(both.rhs(), expanding));
        }
        if (selector instanceof CombinationSelector either) {
            return new CombinationSelector(either.coordinate(), inline(either.lhs(), expanding), inline(either.rhs(), expanding));
        }
        return selector;
    }

    public static class Builder {
        private final Map<String, Selector> rulesets = new LinkedHashMap<>();

        public Builder define(String name, Selector selector) {
            if (name == null || name.isBlank()) {
                throw new IllegalArgumentException("Ruleset name must not be blank");
            }
            if (rulesets.putIfAbsent(name, selector) != null) {
                throw new IllegalArgumentException("Ruleset '" + name + "' is already defined");
            }
            return this;
        }

        public RulesetRegistry build() {
            return new RulesetRegistry(rulesets);
        }
    }
}
