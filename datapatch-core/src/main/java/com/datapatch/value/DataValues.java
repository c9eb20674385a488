package com.datapatch.value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Merging, truthiness and rendering of {@link DataValue}s.
 */
public final class DataValues {

    private DataValues() {
        // Utility class
    }

    /**
     * Deep-merges {@code right} into {@code left}.
     *
     * <p>Objects merge key by key: a {@link DataValue.DeletionValue} on the right removes the key,
     * keys present on both sides merge recursively, every other key from either side is kept.
     * Lists merge index by index the same way, with extra right-hand items appended. Any other
     * combination yields the right-hand value.</p>
     */
    public static DataValue merge(DataValue left, DataValue right) {
        if (right.isDeletion()) {
            return DataValue.DELETION;
        }
        if (left instanceof DataValue.ObjectValue l && right instanceof DataValue.ObjectValue r) {
            Map<String, DataValue> result = new LinkedHashMap<>(l.entries());
            for (Map.Entry<String, DataValue> entry : r.entries().entrySet()) {
                String key = entry.getKey();
                DataValue value = entry.getValue();
                if (value.isDeletion()) {
                    result.remove(key);
                } else if (result.containsKey(key)) {
                    result.put(key, merge(result.get(key), value));
                } else {
                    result.put(key, withoutDeletions(value));
                }
            }
            return new DataValue.ObjectValue(result);
        }
        if (left instanceof DataValue.ListValue l && right instanceof DataValue.ListValue r) {
            List<DataValue> result = new ArrayList<>();
            int size = Math.max(l.size(), r.size());
            for (int i = 0; i < size; i++) {
                if (i >= r.size()) {
                    result.add(l.get(i));
                    continue;
                }
                DataValue value = r.get(i);
                if (value.isDeletion()) {
                    continue;
                }
                result.add(i < l.size() ? merge(l.get(i), value) : withoutDeletions(value));
            }
            return new DataValue.ListValue(result);
        }
        return withoutDeletions(right);
    }

    /**
     * Strips deletion markers nested inside lists and objects; they have nothing to remove there.
     */
    public static DataValue withoutDeletions(DataValue value) {
        if (value instanceof DataValue.ObjectValue object) {
            Map<String, DataValue> result = new LinkedHashMap<>();
            object.entries().forEach((key, entry) -> {
                if (!entry.isDeletion()) {
                    result.put(key, withoutDeletions(entry));
                }
            });
            return new DataValue.ObjectValue(result);
        }
        if (value instanceof DataValue.ListValue list) {
            List<DataValue> result = new ArrayList<>();
            for (DataValue item : list.items()) {
                if (!item.isDeletion()) {
                    result.add(withoutDeletions(item));
                }
            }
            return new DataValue.ListValue(result);
        }
        return value;
    }

    /**
     * false, none, deletion, zero, the empty string and empty collections are falsy.
     */
    public static boolean isTruthy(DataValue value) {
        if (value instanceof DataValue.BoolValue b) {
            return b.value();
        }
        if (value instanceof DataValue.IntValue i) {
            return i.value() != 0;
        }
        if (value instanceof DataValue.FloatValue f) {
            return f.value() != 0.0;
        }
        if (value instanceof DataValue.StringValue s) {
            return !s.value().isEmpty();
        }
        if (value instanceof DataValue.ListValue list) {
            return list.size() > 0;
        }
        if (value instanceof DataValue.ObjectValue object) {
            return object.size() > 0;
        }
        return false;
    }

    public static double toDouble(DataValue value) {
        if (value instanceof DataValue.IntValue i) {
            return i.value();
        }
        if (value instanceof DataValue.FloatValue f) {
            return f.value();
        }
        throw new IllegalArgumentException("Not a number: " + value);
    }

    /**
     * Renders a value as JSON-like text for diagnostics and string conversion.
     */
    public static String render(DataValue value) {
        StringBuilder sb = new StringBuilder();
        render(value, sb);
        return sb.toString();
    }

    private static void render(DataValue value, StringBuilder sb) {
        if (value instanceof DataValue.ListValue list) {
            sb.append('[');
            for (int i = 0; i < list.size(); i++) {
                if (i > 0) {
                    sb.append(", ");
                }
                render(list.get(i), sb);
            }
            sb.append(']');
        } else if (value instanceof DataValue.ObjectValue object) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<String, DataValue> entry : object.entries().entrySet()) {
                if (!first) {
                    sb.append(", ");
                }
                first = false;
                sb.append(quote(entry.getKey())).append(": ");
                render(entry.getValue(), sb);
            }
            sb.append('}');
        } else {
            sb.append(value);
        }
    }

    static String quote(String text) {
        StringBuilder sb = new StringBuilder(text.length() + 2);
        sb.append('"');
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\r' -> sb.append("\\r");
                case '\t' -> sb.append("\\t");
                default -> {
                    if (c < 0x20) {
                        sb.append(String.format("\\u%04x", (int) c));
                    } else {
                        sb.append(c);
                    }
                }
            }
        }
        return sb.append('"').toString();
    }
}
