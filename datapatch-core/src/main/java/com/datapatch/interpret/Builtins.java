package com.datapatch.interpret;

import com.datapatch.diagnostics.PatchTypeException;
import com.datapatch.value.DataValue;
import com.datapatch.value.DataValues;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The function library every {@link PatchEnvironment} starts with.
 */
public final class Builtins {

    private static final Logger log = Logger.getLogger(Builtins.class);

    private static final Map<String, PatchFunction> FUNCTIONS;

    static {
        Map<String, PatchFunction> functions = new LinkedHashMap<>();
        functions.put("len", Builtins::len);
        functions.put("keys", Builtins::keys);
        functions.put("values", Builtins::values);
        functions.put("append", Builtins::append);
        functions.put("contains", Builtins::contains);
        functions.put("str", Builtins::str);
        functions.put("int", Builtins::toInt);
        functions.put("float", Builtins::toFloat);
        functions.put("type_of", call -> DataValue.of(call.expect(1).value(0).kind().displayName()));
        functions.put("range", Builtins::range);
        functions.put("map", Builtins::map);
        functions.put("filter", Builtins::filter);
        functions.put("log", Builtins::log);
        FUNCTIONS = Collections.unmodifiableMap(functions);
    }

    private Builtins() {
        // Utility class
    }

    public static Map<String, PatchFunction> all() {
        return FUNCTIONS;
    }

    private static DataValue len(Invocation call) {
        DataValue value = call.expect(1).value(0);
        if (value instanceof DataValue.StringValue s) {
            return DataValue.of(s.value().length());
        }
        if (value instanceof DataValue.ListValue list) {
            return DataValue.of(list.size());
        }
        if (value instanceof DataValue.ObjectValue object) {
            return DataValue.of(object.size());
        }
        throw new PatchTypeException(call.coordinate(), "A " + value.kind().displayName() + " has no length");
    }

    private static DataValue keys(Invocation call) {
        List<DataValue> keys = new ArrayList<>();
        for (String key : call.expect(1).object(0).entries().keySet()) {
            keys.add(DataValue.of(key));
        }
        return DataValue.list(keys);
    }

    private static DataValue values(Invocation call) {
        return DataValue.list(new ArrayList<>(call.expect(1).object(0).entries().values()));
    }

    private static DataValue append(Invocation call) {
        call.expect(2, Integer.MAX_VALUE);
        DataValue.ListValue list = call.list(0);
        for (int i = 1; i < call.size(); i++) {
            list = list.append(call.value(i));
        }
        return list;
    }

    private static DataValue contains(Invocation call) {
        DataValue haystack = call.expect(2).value(0);
        DataValue needle = call.value(1);
        if (haystack instanceof DataValue.ListValue list) {
            return DataValue.of(list.items().stream().anyMatch(item -> ValueOperations.valuesEqual(item, needle)));
        }
        if (haystack instanceof DataValue.ObjectValue object) {
            return DataValue.of(object.containsKey(call.string(1)));
        }
        if (haystack instanceof DataValue.StringValue s) {
            return DataValue.of(s.value().contains(call.string(1)));
        }
        throw new PatchTypeException(call.coordinate(), "Cannot search a " + haystack.kind().displayName());
    }

    private static DataValue str(Invocation call) {
        DataValue value = call.expect(1).value(0);
        if (value instanceof DataValue.StringValue) {
            return value;
        }
        return DataValue.of(DataValues.render(value));
    }

    private static DataValue toInt(Invocation call) {
        DataValue value = call.expect(1).value(0);
        if (value instanceof DataValue.IntValue) {
            return value;
        }
        if (value instanceof DataValue.FloatValue f) {
            return DataValue.of((long) f.value());
        }
        if (value instanceof DataValue.BoolValue b) {
            return DataValue.of(b.value() ? 1L : 0L);
        }
        if (value instanceof DataValue.StringValue s) {
            try {
                return DataValue.of(Long.parseLong(s.value().trim()));
            } catch (NumberFormatException e) {
                throw new PatchTypeException(call.coordinate(), "Cannot convert " + s + " to an int", e);
            }
        }
        throw new PatchTypeException(call.coordinate(), "Cannot convert a " + value.kind().displayName() + " to an int");
    }

    private static DataValue toFloat(Invocation call) {
        DataValue value = call.expect(1).value(0);
        if (value.isNumeric()) {
            return DataValue.of(DataValues.toDouble(value));
        }
        if (value instanceof DataValue.StringValue s) {
            try {
                return DataValue.of(Double.parseDouble(s.value().trim()));
            } catch (NumberFormatException e) {
                throw new PatchTypeException(call.coordinate(), "Cannot convert " + s + " to a float", e);
            }
        }
        throw new PatchTypeException(call.coordinate(), "Cannot convert a " + value.kind().displayName() + " to a float");
    }

    /**
     * {@code range(n)} is 0 up to n exclusive, {@code range(a, b)} is a up to b exclusive.
     */
    private static DataValue range(Invocation call) {
        call.expect(1, 2);
        long from = call.size() == 1 ? 0 : call.integer(0);
        long to = call.integer(call.size() - 1);
        List<DataValue> items = new ArrayList<>();
        for (long i = from; i < to; i++) {
            items.add(DataValue.of(i));
        }
        return DataValue.list(items);
    }

    private static DataValue map(Invocation call) {
        DataValue.ListValue list = call.expect(2).list(0);
        PatchClosure closure = call.closure(1);
        List<DataValue> mapped = new ArrayList<>(list.size());
        for (DataValue item : list.items()) {
            mapped.add(closure.call(item));
        }
        return DataValue.list(mapped);
    }

    private static DataValue filter(Invocation call) {
        DataValue.ListValue list = call.expect(2).list(0);
        PatchClosure closure = call.closure(1);
        List<DataValue> kept = new ArrayList<>();
        for (DataValue item : list.items()) {
            if (DataValues.isTruthy(closure.call(item))) {
                kept.add(item);
            }
        }
        return DataValue.list(kept);
    }

    private static DataValue log(Invocation call) {
        call.expect(0, Integer.MAX_VALUE);
        StringBuilder message = new StringBuilder();
        for (int i = 0; i < call.size(); i++) {
            if (i > 0) {
                message.append(' ');
            }
            DataValue value = call.value(i);
            message.append(value instanceof DataValue.StringValue s ? s.value() : DataValues.render(value));
        }
        log.info(call.coordinate() + ": " + message);
        return DataValue.NONE;
    }
}
