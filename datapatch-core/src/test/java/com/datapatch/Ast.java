package com.datapatch;

import com.datapatch.ast.*;
import com.datapatch.value.DataValue;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shorthand for building AST nodes directly in interpreter and selector tests.
 */
public final class Ast {

    public static final Coordinate AT = Coordinate.of("test.patch", 1, 0);

    private Ast() {
    }

    public static Literal lit(long value) {
        return new Literal(AT, DataValue.of(value));
    }

    public static Literal lit(double value) {
        return new Literal(AT, DataValue.of(value));
    }

    public static Literal lit(String value) {
        return new Literal(AT, DataValue.of(value));
    }

    public static Literal lit(boolean value) {
        return new Literal(AT, DataValue.of(value));
    }

    public static Literal lit(DataValue value) {
        return new Literal(AT, value);
    }

    public static VariableReference var(String name) {
        return new VariableReference(AT, name);
    }

    public static LocalVariableReference local(String name) {
        return new LocalVariableReference(AT, name);
    }

    public static BinaryExpression op(BinaryOperator operator, Expression lhs, Expression rhs) {
        return new BinaryExpression(AT, operator, lhs, rhs);
    }

    /**
     * Object literal from alternating keys and expressions.
     */
    public static ObjectExpression obj(Object... keysAndValues) {
        Map<String, Expression> entries = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            entries.put((String) keysAndValues[i], (Expression) keysAndValues[i + 1]);
        }
        return new ObjectExpression(AT, entries.entrySet().stream()
            .map(e -> new KeyValue(AT, e.getKey(), e.getValue()))
            .toList());
    }

    public static ListExpression list(Expression... items) {
        return new ListExpression(AT, List.of(items));
    }

    public static SimpleCall call(String function, Expression... arguments) {
        return new SimpleCall(AT, function, Arrays.stream(arguments).map(a -> new CallArgument(AT, a)).toList());
    }

    public static CallArgument named(String name, Expression value) {
        return new CallArgument(AT, name, value);
    }

    public static SimpleCall callWith(String function, CallArgument... arguments) {
        return new SimpleCall(AT, function, List.of(arguments));
    }

    public static VariableDeclaration let(String name, Expression value) {
        return new VariableDeclaration(AT, name, value);
    }

    public static Return ret(Expression value) {
        return new Return(AT, value);
    }

    public static Argument param(String name) {
        return new Argument(AT, name);
    }

    public static Argument param(String name, Expression defaultValue) {
        return new Argument(AT, name, defaultValue);
    }

    public static FunctionDefinition function(String name, List<Argument> parameters, Statement... body) {
        return new FunctionDefinition(AT, name, parameters, List.of(body));
    }

    public static ElementSelector element(String type) {
        return new ElementSelector(AT, type);
    }

    public static ClassSelector clazz(String name) {
        return new ClassSelector(AT, name);
    }

    public static NameSelector name(String name) {
        return new NameSelector(AT, name);
    }

    public static SelectionBlock select(Selector selector, Statement... body) {
        return new SelectionBlock(AT, List.of(), selector, List.of(body));
    }

    public static SelectionBlock select(List<Attribute> attributes, Selector selector, Statement... body) {
        return new SelectionBlock(AT, attributes, selector, List.of(body));
    }

    public static SetValue set(Expression value) {
        return new SetValue(AT, value);
    }

    public static MergeValue merge(Expression value) {
        return new MergeValue(AT, value);
    }

    public static Field field(String key, Expression value) {
        return new Field(AT, key, null, value);
    }

    public static Field field(String key, Indexer indexer, Expression value) {
        return new Field(AT, key, indexer, value);
    }

    public static Patch patch(Statement... statements) {
        return new Patch(AT, List.of(statements));
    }
}
