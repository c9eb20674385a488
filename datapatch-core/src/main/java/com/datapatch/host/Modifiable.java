package com.datapatch.host;

import com.datapatch.value.DataValue;

/**
 * Edit access to the value behind one {@link Selectable}. Opened per matched element and
 * completed once the selection body has run.
 *
 * <p>Any edit may fail with a {@link com.datapatch.diagnostics.HostRejectionException}, for
 * example on read-only elements.</p>
 */
public interface Modifiable {

    DataValue getValue();

    /**
     * @return the field's value, or null when the value has no such field
     */
    DataValue getFieldValue(String field);

    /**
     * Replaces one field; a {@link DataValue.DeletionValue} removes it.
     */
    void setFieldValue(String field, DataValue value);

    /**
     * Replaces the whole value; a {@link DataValue.DeletionValue} removes the element.
     */
    void set(DataValue value);

    void merge(DataValue value);

    void delete();

    /**
     * Ends the modification and tells the host whether anything changed.
     */
    void complete();
}
