package com.datapatch.host;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Explicit mapping from a stable type tag to the factory that wraps data of that type.
 * Tags and factories are validated when registered, never looked up reflectively.
 */
public class SelectableRegistry<T> {

    private final Map<String, SelectableFactory<T>> factories = new LinkedHashMap<>();

    public synchronized SelectableRegistry<T> register(String typeTag, SelectableFactory<T> factory) {
        if (typeTag == null || typeTag.isBlank()) {
            throw new IllegalArgumentException("Type tag must not be blank");
        }
        if (factory == null) {
            throw new IllegalArgumentException("No factory given for type tag '" + typeTag + "'");
        }
        if (factories.containsKey(typeTag)) {
            throw new IllegalArgumentException("Type tag '" + typeTag + "' is already registered");
        }
        factories.put(typeTag, factory);
        return this;
    }

    public synchronized Optional<SelectableFactory<T>> lookup(String typeTag) {
        return Optional.ofNullable(typeTag == null ? null : factories.get(typeTag));
    }

    /**
     * Wraps {@code data} with the factory registered for {@code typeTag}, or with
     * {@code fallback} when the tag is unknown or null.
     */
    public Selectable wrap(String typeTag, T data, SelectableFactory<T> fallback) {
        return lookup(typeTag).orElse(fallback).create(typeTag, data);
    }

    public synchronized Set<String> tags() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(factories.keySet()));
    }
}
