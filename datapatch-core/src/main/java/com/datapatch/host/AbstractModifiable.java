package com.datapatch.host;

import com.datapatch.diagnostics.PatchTypeException;
import com.datapatch.value.DataValue;
import com.datapatch.value.DataValues;

/**
 * Implements field access, merge and delete on top of whole-value reads and writes.
 * Subclasses write the value back to their storage and react to completion.
 */
public abstract class AbstractModifiable implements Modifiable {

    private boolean modified;
    private boolean completed;

    /**
     * Stores {@code value}; a deletion marker means the element itself goes away.
     */
    protected abstract void write(DataValue value);

    /**
     * Called once from {@link #complete()} when at least one edit was made.
     */
    protected abstract void onModified();

    @Override
    public DataValue getFieldValue(String field) {
        return requireObject().get(field);
    }

    @Override
    public void setFieldValue(String field, DataValue value) {
        DataValue.ObjectValue object = requireObject();
        if (value.isDeletion()) {
            set(object.without(field));
        } else {
            set(object.with(field, DataValues.withoutDeletions(value)));
        }
    }

    @Override
    public void set(DataValue value) {
        if (completed) {
            throw new IllegalStateException("Modification already completed");
        }
        write(value.isDeletion() ? value : DataValues.withoutDeletions(value));
        modified = true;
    }

    @Override
    public void merge(DataValue value) {
        set(DataValues.merge(getValue(), value));
    }

    @Override
    public void delete() {
        set(DataValue.DELETION);
    }

    @Override
    public void complete() {
        if (completed) {
            return;
        }
        completed = true;
        if (modified) {
            onModified();
        }
    }

    public boolean isModified() {
        return modified;
    }

    private DataValue.ObjectValue requireObject() {
        DataValue value = getValue();
        if (value instanceof DataValue.ObjectValue object) {
            return object;
        }
        throw new PatchTypeException(null, "Cannot access fields of a " + value.kind().displayName() + " value");
    }
}
