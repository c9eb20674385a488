package com.datapatch.value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Closed dynamic value type used for literals, variables and element data.
 *
 * <p>All variants are immutable. {@link ListValue} and {@link ObjectValue} compare deeply;
 * {@link ObjectValue} keeps insertion order. {@link NoneValue} is an explicit null, distinct from
 * an absent field, while {@link DeletionValue} means "remove this location" when it reaches a
 * set or merge.</p>
 */
public sealed interface DataValue permits
    DataValue.NoneValue,
    DataValue.DeletionValue,
    DataValue.BoolValue,
    DataValue.IntValue,
    DataValue.FloatValue,
    DataValue.StringValue,
    DataValue.ListValue,
    DataValue.ObjectValue {

    DataValue NONE = new NoneValue();
    DataValue DELETION = new DeletionValue();
    DataValue TRUE = new BoolValue(true);
    DataValue FALSE = new BoolValue(false);

    DataKind kind();

    static DataValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    static DataValue of(long value) {
        return new IntValue(value);
    }

    static DataValue of(double value) {
        return new FloatValue(value);
    }

    static DataValue of(String value) {
        return value == null ? NONE : new StringValue(value);
    }

    static ListValue list(DataValue... items) {
        return new ListValue(List.of(items));
    }

    static ListValue list(List<DataValue> items) {
        return new ListValue(items);
    }

    static ObjectValue object(Map<String, DataValue> entries) {
        return new ObjectValue(entries);
    }

    /**
     * Builds an object from alternating keys and values.
     */
    static ObjectValue object(Object... keysAndValues) {
        if (keysAndValues.length % 2 != 0) {
            throw new IllegalArgumentException("Expected alternating keys and values");
        }
        Map<String, DataValue> entries = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.put((String) keysAndValues[i], (DataValue) keysAndValues[i + 1]);
        }
        return new ObjectValue(entries);
    }

    default boolean isNone() {
        return kind() == DataKind.NONE;
    }

    default boolean isDeletion() {
        return kind() == DataKind.DELETION;
    }

    default boolean isNumeric() {
        return kind().isNumeric();
    }

    record NoneValue() implements DataValue {
        @Override
        public DataKind kind() {
            return DataKind.NONE;
        }

        @Override
        public String toString() {
            return "null";
        }
    }

    record DeletionValue() implements DataValue {
        @Override
        public DataKind kind() {
            return DataKind.DELETION;
        }

        @Override
        public String toString() {
            return "<deletion>";
        }
    }

    record BoolValue(boolean value) implements DataValue {
        @Override
        public DataKind kind() {
            return DataKind.BOOL;
        }

        @Override
        public String toString() {
            return Boolean.toString(value);
        }
    }

    record IntValue(long value) implements DataValue {
        @Override
        public DataKind kind() {
            return DataKind.INT;
        }

        @Override
        public String toString() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements DataValue {
        @Override
        public DataKind kind() {
            return DataKind.FLOAT;
        }

        @Override
        public String toString() {
            return Double.toString(value);
        }
    }

    record StringValue(String value) implements DataValue {
        public StringValue {
            if (value == null) {
                throw new IllegalArgumentException("String value cannot be null, use DataValue.NONE");
            }
        }

        @Override
        public DataKind kind() {
            return DataKind.STRING;
        }

        @Override
        public String toString() {
            return DataValues.quote(value);
        }
    }

    record ListValue(List<DataValue> items) implements DataValue {
        public ListValue {
            items = List.copyOf(items);
        }

        @Override
        public DataKind kind() {
            return DataKind.LIST;
        }

        public int size() {
            return items.size();
        }

        public DataValue get(int index) {
            return items.get(index);
        }

        public ListValue with(int index, DataValue value) {
            List<DataValue> copy = new ArrayList<>(items);
            copy.set(index, value);
            return new ListValue(copy);
        }

        public ListValue without(int index) {
            List<DataValue> copy = new ArrayList<>(items);
            copy.remove(index);
            return new ListValue(copy);
        }

        public ListValue append(DataValue value) {
            List<DataValue> copy = new ArrayList<>(items);
            copy.add(value);
            return new ListValue(copy);
        }

        @Override
        public String toString() {
            return DataValues.render(this);
        }
    }

    record ObjectValue(Map<String, DataValue> entries) implements DataValue {
        public ObjectValue {
            Map<String, DataValue> copy = new LinkedHashMap<>();
            entries.forEach((key, value) -> {
                if (key == null || value == null) {
                    throw new IllegalArgumentException("Object keys and values cannot be null");
                }
                copy.put(key, value);
            });
            entries = Collections.unmodifiableMap(copy);
        }

        public static ObjectValue empty() {
            return new ObjectValue(Map.of());
        }

        @Override
        public DataKind kind() {
            return DataKind.OBJECT;
        }

        public int size() {
            return entries.size();
        }

        public boolean containsKey(String key) {
            return entries.containsKey(key);
        }

        /**
         * @return the value under {@code key}, or null when absent
         */
        public DataValue get(String key) {
            return entries.get(key);
        }

        public ObjectValue with(String key, DataValue value) {
            Map<String, DataValue> copy = new LinkedHashMap<>(entries);
            copy.put(key, value);
            return new ObjectValue(copy);
        }

        public ObjectValue without(String key) {
            if (!entries.containsKey(key)) {
                return this;
            }
            Map<String, DataValue> copy = new LinkedHashMap<>(entries);
            copy.remove(key);
            return new ObjectValue(copy);
        }

        @Override
        public String toString() {
            return DataValues.render(this);
        }
    }
}
