package com.datapatch.interpret;

import com.datapatch.ast.Coordinate;
import com.datapatch.diagnostics.ArityException;
import com.datapatch.diagnostics.PatchTypeException;
import com.datapatch.value.DataKind;
import com.datapatch.value.DataValue;

import java.util.List;
import java.util.Map;

/**
 * The arguments of one call to a {@link PatchFunction}. Positional arguments are either
 * {@link DataValue}s or, where a closure was written at the call site, {@link PatchClosure}s.
 * For a member call {@code a.f(b)} the receiver {@code a} is argument 0.
 */
public final class Invocation {

    private final String function;
    private final Coordinate coordinate;
    private final List<Object> arguments;
    private final Map<String, DataValue> namedArguments;

    Invocation(String function, Coordinate coordinate, List<Object> arguments, Map<String, DataValue> namedArguments) {
        this.function = function;
        this.coordinate = coordinate;
        this.arguments = List.copyOf(arguments);
        this.namedArguments = Map.copyOf(namedArguments);
    }

    /**
     * Builds an invocation outside the interpreter, for hosts testing their own functions.
     */
    public static Invocation of(String function, DataValue... arguments) {
        return new Invocation(function, Coordinate.UNKNOWN, List.of((Object[]) arguments), Map.of());
    }

    public String function() {
        return function;
    }

    public Coordinate coordinate() {
        return coordinate;
    }

    public int size() {
        return arguments.size();
    }

    public Map<String, DataValue> namedArguments() {
        return namedArguments;
    }

    /**
     * Checks the positional argument count and rejects named arguments.
     *
     * @throws ArityException if the call does not fit
     */
    public Invocation expect(int min, int max) {
        if (!namedArguments.isEmpty()) {
            throw new ArityException(coordinate, "Function '" + function + "' does not take named arguments");
        }
        if (arguments.size() < min || arguments.size() > max) {
            String expected = min == max ? Integer.toString(min) : min + " to " + max;
            throw new ArityException(coordinate, "Function '" + function + "' expects " + expected
                + " argument(s) but was given " + arguments.size());
        }
        return this;
    }

    public Invocation expect(int count) {
        return expect(count, count);
    }

    public DataValue value(int index) {
        Object argument = arguments.get(index);
        if (argument instanceof DataValue value) {
            return value;
        }
        throw new PatchTypeException(coordinate,
            "Argument " + (index + 1) + " of '" + function + "' must be a value, not a closure");
    }

    public PatchClosure closure(int index) {
        Object argument = arguments.get(index);
        if (argument instanceof PatchClosure closure) {
            return closure;
        }
        throw new PatchTypeException(coordinate,
            "Argument " + (index + 1) + " of '" + function + "' must be a closure");
    }

    public long integer(int index) {
        return ((DataValue.IntValue) require(index, DataKind.INT)).value();
    }

    public String string(int index) {
        return ((DataValue.StringValue) require(index, DataKind.STRING)).value();
    }

    public DataValue.ListValue list(int index) {
        return (DataValue.ListValue) require(index, DataKind.LIST);
    }

    public DataValue.ObjectValue object(int index) {
        return (DataValue.ObjectValue) require(index, DataKind.OBJECT);
    }

    private DataValue require(int index, DataKind kind) {
        DataValue value = value(index);
        if (value.kind() != kind) {
            throw new PatchTypeException(coordinate, "Argument " + (index + 1) + " of '" + function + "' must be a "
                + kind.displayName() + " but was a " + value.kind().displayName());
        }
        return value;
    }
}
