package com.datapatch.host;

import com.datapatch.value.DataValue;

import java.util.List;

/**
 * A node of the host's element tree, as seen by selectors and selection blocks.
 *
 * <p>{@link #children()} must return children in document order; selectors never re-sort them.
 * Edits go through {@link #openModification()}.</p>
 */
public interface Selectable {

    String name();

    String elementType();

    List<String> classes();

    List<Selectable> children();

    /**
     * Identity test: whether both objects wrap the same underlying element.
     */
    boolean isSameAs(Selectable other);

    /**
     * A key shared by every wrapper of the same underlying element and compared by reference.
     * Hosts that hand out a fresh wrapper per lookup return the wrapped object.
     */
    default Object identity() {
        return this;
    }

    Modifiable openModification();

    /**
     * Creates a new child element of the given type and returns it.
     *
     * @throws com.datapatch.diagnostics.PatchRuntimeException if the host cannot create such a child
     */
    Selectable addElement(String elementType);

    String serialize();

    DataValue getValue();
}
