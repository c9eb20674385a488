package com.datapatch.interpret;

import com.datapatch.value.DataValue;

import java.util.HashMap;
import java.util.Map;

/**
 * One level of the lexical scope chain. The root is the patch-global scope.
 */
final class Scope {

    private final Scope parent;
    private final boolean selection;
    private final Map<String, DataValue> variables = new HashMap<>();

    Scope(Scope parent) {
        this(parent, false);
    }

    private Scope(Scope parent, boolean selection) {
        this.parent = parent;
        this.selection = selection;
    }

    static Scope global() {
        return new Scope(null);
    }

    Scope child() {
        return new Scope(this);
    }

    /**
     * A scope for the body of a selection block. Its element bindings win over outer ones.
     */
    Scope selectionChild() {
        return new Scope(this, true);
    }

    /**
     * Binds {@code name} in this scope, shadowing any outer binding.
     */
    void declare(String name, DataValue value) {
        variables.put(name, value);
    }

    /**
     * Rebinds the nearest existing binding of {@code name}, or declares it here if there is none.
     */
    void assign(String name, DataValue value) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.variables.containsKey(name)) {
                scope.variables.put(name, value);
                return;
            }
        }
        variables.put(name, value);
    }

    /**
     * @return the binding closest to the global scope, or null
     */
    DataValue lookupOutermost(String name) {
        DataValue found = null;
        for (Scope scope = this; scope != null; scope = scope.parent) {
            DataValue value = scope.variables.get(name);
            if (value != null) {
                found = value;
            }
        }
        return found;
    }

    /**
     * @return the binding of {@code name} in the nearest enclosing selection scope, or null
     */
    DataValue lookupSelected(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            if (scope.selection) {
                return scope.variables.get(name);
            }
        }
        return null;
    }

    /**
     * @return the binding closest to this scope, or null
     */
    DataValue lookupInnermost(String name) {
        for (Scope scope = this; scope != null; scope = scope.parent) {
            DataValue value = scope.variables.get(name);
            if (value != null) {
                return value;
            }
        }
        return null;
    }
}
