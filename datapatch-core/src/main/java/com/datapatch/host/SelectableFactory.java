package com.datapatch.host;

/**
 * Wraps host data of type {@code T} carrying a given type tag into a {@link Selectable}.
 */
@FunctionalInterface
public interface SelectableFactory<T> {

    Selectable create(String typeTag, T data);
}
