package com.datapatch.select;

import com.datapatch.ast.ChildSelector;
import com.datapatch.ast.ClassSelector;
import com.datapatch.ast.CombinationSelector;
import com.datapatch.ast.ElementAdditionSelector;
import com.datapatch.ast.ElementSelector;
import com.datapatch.ast.ErrorNode;
import com.datapatch.ast.IntersectionSelector;
import com.datapatch.ast.NameSelector;
import com.datapatch.ast.RulesetSelector;
import com.datapatch.ast.Selector;
import com.datapatch.ast.WildcardSelector;
import com.datapatch.ast.WithoutClassSelector;
import com.datapatch.ast.WithoutNameSelector;
import com.datapatch.diagnostics.DiagnosticKind;
import com.datapatch.diagnostics.PatchRuntimeException;
import com.datapatch.diagnostics.ResolutionException;
import com.datapatch.host.Selectable;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tests selectors against host elements and enumerates matches.
 *
 * <p>Enumeration is depth-first in the order the host exposes children. An element reachable
 * twice (per {@link Selectable#identity}) is reported once. The engine holds no per-run state and
 * may be shared between threads as long as the trees it walks are not.</p>
 */
public class SelectorEngine {

    private static final Logger log = Logger.getLogger(SelectorEngine.class);

    private final RulesetRegistry rulesets;

    public SelectorEngine(RulesetRegistry rulesets) {
        this.rulesets = rulesets;
    }

    public SelectorEngine() {
        this(RulesetRegistry.empty());
    }

    public boolean matches(Selector selector, Selectable candidate) {
        return matches(selector, candidate, List.of());
    }

    /**
     * @param ancestors the candidate's ancestors, outermost first
     */
    public boolean matches(Selector selector, Selectable candidate, List<Selectable> ancestors) {
        if (selector instanceof ElementSelector element) {
            return Objects.equals(candidate.elementType(), element.elementType());
        }
        if (selector instanceof NameSelector name) {
            return Objects.equals(candidate.name(), name.name());
        }
        if (selector instanceof ClassSelector clazz) {
            return candidate.classes().contains(clazz.className());
        }
        if (selector instanceof WildcardSelector) {
            return true;
        }
        if (selector instanceof WithoutClassSelector clazz) {
            return !candidate.classes().contains(clazz.className());
        }
        if (selector instanceof WithoutNameSelector name) {
            return !Objects.equals(candidate.name(), name.name());
        }
        if (selector instanceof IntersectionSelector both) {
            return matches(both.lhs(), candidate, ancestors) && matches(both.rhs(), candidate, ancestors);
        }
        if (selector instanceof CombinationSelector either) {
            return matches(either.lhs(), candidate, ancestors) || matches(either.rhs(), candidate, ancestors);
        }
        if (selector instanceof ChildSelector child) {
            return matches(child.child(), candidate, ancestors) && hasAncestorMatching(child.parent(), ancestors);
        }
        if (selector instanceof RulesetSelector reference) {
            return matches(rulesets.expand(reference), candidate, ancestors);
        }
        if (selector instanceof ElementAdditionSelector) {
            return false;
        }
        if (selector instanceof ErrorNode error) {
            throw new PatchRuntimeException(DiagnosticKind.SYNTAX, error.coordinate(),
                "Cannot match an erroneous selector: " + error.message());
        }
        throw new IllegalStateException("Unhandled selector " + selector.type());
    }

    private boolean hasAncestorMatching(Selector parent, List<Selectable> ancestors) {
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            if (matches(parent, ancestors.get(i), ancestors.subList(0, i))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Selects among the given roots and all of their descendants.
     */
    public List<Match> find(Selector selector, List<Selectable> roots) {
        return resolve(selector, null, roots);
    }

    /**
     * Selects among the descendants of an already selected element. Element additions create
     * children of that element.
     */
    public List<Match> findWithin(Selector selector, Match owner) {
        return resolve(selector, owner, owner.element().children());
    }

    /**
     * Convenience form of {@link #find} returning only the elements.
     */
    public List<Selectable> select(Selector selector, List<Selectable> roots) {
        return find(selector, roots).stream().map(Match::element).toList();
    }

    private List<Match> resolve(Selector selector, Match owner, List<Selectable> scope) {
        if (selector instanceof RulesetSelector reference) {
            return resolve(rulesets.expand(reference), owner, scope);
        }
        if (selector instanceof ElementAdditionSelector addition) {
            if (owner == null) {
                throw new ResolutionException(addition.coordinate(),
                    "Adding a '" + addition.elementType() + "' element requires a parent element");
            }
            return List.of(add(owner, addition));
        }
        if (selector instanceof ChildSelector child && child.child() instanceof ElementAdditionSelector addition) {
            List<Match> created = new ArrayList<>();
            for (Match parent : resolve(child.parent(), owner, scope)) {
                created.add(add(parent, addition));
            }
            return created;
        }

        List<Match> matches = new ArrayList<>();
        List<Selectable> path = owner == null ? new ArrayList<>() : owner.ancestorsAndSelf();
        Set<Object> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (Selectable root : scope) {
            collect(selector, root, path, seen, matches);
        }
        if (log.isDebugEnabled()) {
            log.debug(selector.coordinate() + ": " + selector.type() + " matched " + matches.size() + " element(s)");
        }
        return matches;
    }

    private void collect(Selector selector, Selectable node, List<Selectable> ancestors, Set<Object> seen,
                         List<Match> out) {
        if (!seen.add(node.identity())) {
            return;
        }
        if (matches(selector, node, ancestors)) {
            out.add(new Match(node, ancestors));
        }
        ancestors.add(node);
        try {
            for (Selectable child : node.children()) {
                collect(selector, child, ancestors, seen, out);
            }
        } finally {
            ancestors.remove(ancestors.size() - 1);
        }
    }

    private Match add(Match parent, ElementAdditionSelector addition) {
        Selectable created;
        try {
            created = parent.element().addElement(addition.elementType());
        } catch (PatchRuntimeException e) {
            throw e.locate(addition.coordinate());
        }
        return new Match(created, parent.ancestorsAndSelf());
    }
}
