package com.datapatch.jackson;

import com.datapatch.diagnostics.HostRejectionException;
import com.datapatch.host.AbstractModifiable;
import com.datapatch.value.DataValue;

/**
 * Edits the {@code value} of one document element. Deleting the value removes the element
 * from its parent, and the element takes no further edits after that.
 */
public class JsonModifiable extends AbstractModifiable {

    private final JsonElement element;
    private boolean removed;

    public JsonModifiable(JsonElement element) {
        this.element = element;
    }

    @Override
    public DataValue getValue() {
        return JsonValues.toDataValue(element.node().get(JsonDocument.VALUE));
    }

    @Override
    protected void write(DataValue value) {
        if (removed) {
            throw new HostRejectionException("Element '" + element.elementType() + "' was deleted earlier in this block");
        }
        if (value.isDeletion()) {
            element.document().remove(element);
            removed = true;
        } else {
            element.node().set(JsonDocument.VALUE, JsonValues.toJsonNode(value));
        }
    }

    @Override
    protected void onModified() {
        element.document().recordModification(element);
    }
}
