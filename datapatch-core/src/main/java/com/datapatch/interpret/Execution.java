package com.datapatch.interpret;

import com.datapatch.ast.*;
import com.datapatch.diagnostics.ArityException;
import com.datapatch.diagnostics.DiagnosticKind;
import com.datapatch.diagnostics.PatchRuntimeException;
import com.datapatch.diagnostics.PatchTypeException;
import com.datapatch.diagnostics.ResolutionException;
import com.datapatch.host.Modifiable;
import com.datapatch.host.Selectable;
import com.datapatch.select.Match;
import com.datapatch.select.SelectorEngine;
import com.datapatch.value.DataValue;
import com.datapatch.value.DataValues;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;

/**
 * State of one run of one patch: its global scope, the functions and mixins it defined, the
 * element being edited and what the run has declared so far. Discarded when the run ends.
 */
final class Execution {

    private static final Logger log = Logger.getLogger(Execution.class);

    static final int MAX_CALL_DEPTH = 512;

    /** Names a selection block binds to the element it is editing. */
    private static final Set<String> ELEMENT_BINDINGS = Set.of("value", "name", "element_type");

    private final PatchEnvironment environment;
    private final SelectorEngine engine;
    private final List<Selectable> roots;
    private final String stage;

    private final Scope global = Scope.global();
    private final Map<String, Defined> functions = new HashMap<>();
    private final Map<String, MixinDefinition> mixins = new HashMap<>();
    private final Set<String> importing = new HashSet<>();

    private final Map<String, Long> stages = new LinkedHashMap<>();
    private final List<String> labels = new ArrayList<>();
    private final Set<String> stageTags = new LinkedHashSet<>();
    private int modifiedElements;

    private Selection selection;
    private FieldTarget fieldTarget;
    private int callDepth;

    Execution(PatchEnvironment environment, SelectorEngine engine, List<Selectable> roots, String stage) {
        this.environment = environment;
        this.engine = engine;
        this.roots = roots;
        this.stage = stage;
    }

    void run(Patch patch) {
        for (Statement statement : patch.statements()) {
            expectNoReturn(execute(statement, global), statement);
        }
    }

    PatchResult result(PatchRuntimeException error) {
        return new PatchResult(stages, labels, stageTags, modifiedElements, error);
    }

    // ==================== Statements ====================

    private Flow execute(List<Statement> body, Scope scope) {
        for (Statement statement : body) {
            Flow flow = execute(statement, scope);
            if (flow instanceof Flow.Return) {
                return flow;
            }
        }
        return Flow.CONTINUE;
    }

    private Flow execute(Statement statement, Scope scope) {
        try {
            return dispatch(statement, scope);
        } catch (PatchRuntimeException e) {
            throw e.locate(statement.coordinate());
        }
    }

    private Flow dispatch(Statement statement, Scope scope) {
        if (statement instanceof PatchDeclaration declaration) {
            labels.addAll(declaration.labels());
        } else if (statement instanceof Import include) {
            importLibrary(include);
        } else if (statement instanceof VariableDeclaration declaration) {
            scope.assign(declaration.name(), evaluate(declaration.value(), scope));
        } else if (statement instanceof StageDefinition definition) {
            stages.put(definition.stage(), definition.priority());
        } else if (statement instanceof FunctionDefinition definition) {
            functions.put(definition.name(), new Defined(definition, scope));
        } else if (statement instanceof MixinDefinition definition) {
            mixins.put(definition.name(), definition);
        } else if (statement instanceof Conditional conditional) {
            if (condition(conditional.condition(), scope)) {
                return execute(conditional.body(), scope.child());
            }
            if (conditional.otherwise() != null) {
                return execute(conditional.otherwise(), scope);
            }
        } else if (statement instanceof Block block) {
            return execute(block.body(), scope.child());
        } else if (statement instanceof SelectionBlock block) {
            select(block, scope);
        } else if (statement instanceof SetValue set) {
            Selection current = requireSelection(set);
            current.modifiable.set(evaluate(set.value(), scope));
            current.edited = true;
        } else if (statement instanceof DeleteValue delete) {
            Selection current = requireSelection(delete);
            current.modifiable.delete();
            current.edited = true;
        } else if (statement instanceof MergeValue merge) {
            Selection current = requireSelection(merge);
            current.modifiable.merge(evaluate(merge.value(), scope));
            current.edited = true;
        } else if (statement instanceof Field field) {
            assignField(field, scope);
        } else if (statement instanceof MixinInclude include) {
            includeMixin(include, scope);
        } else if (statement instanceof Return ret) {
            return new Flow.Return(evaluate(ret.value(), scope));
        } else if (statement instanceof For loop) {
            return forLoop(loop, scope);
        } else if (statement instanceof Each loop) {
            return eachLoop(loop, scope);
        } else if (statement instanceof While loop) {
            return whileLoop(loop, scope);
        } else if (statement instanceof ErrorNode error) {
            throw erroneous(error);
        } else {
            throw new IllegalStateException("Unhandled statement " + statement.type());
        }
        return Flow.CONTINUE;
    }

    private void importLibrary(Import include) {
        Patch library = environment.library(include.library());
        if (library == null) {
            throw new ResolutionException(include.coordinate(), "Unknown library '" + include.library() + "'");
        }
        if (!importing.add(include.library())) {
            throw new ResolutionException(include.coordinate(), "Library '" + include.library() + "' imports itself");
        }
        try {
            run(library);
        } finally {
            importing.remove(include.library());
        }
    }

    private void expectNoReturn(Flow flow, Statement statement) {
        if (flow instanceof Flow.Return) {
            throw new ResolutionException(statement.coordinate(), "Return outside of a function");
        }
    }

    // ==================== Selection blocks ====================

    private void select(SelectionBlock block, Scope scope) {
        boolean nested = selection != null;
        String tag = null;
        NewAssetAttribute newAsset = null;
        for (Attribute attribute : block.attributes()) {
            if (attribute instanceof RequireModAttribute require) {
                if (!environment.isModActive(require.mod())) {
                    skipped(block, "mod '" + require.mod() + "' is not active");
                    return;
                }
            } else if (attribute instanceof RequireNotModAttribute require) {
                if (environment.isModActive(require.mod())) {
                    skipped(block, "mod '" + require.mod() + "' is active");
                    return;
                }
            } else if (attribute instanceof RunAtStageAttribute runAt) {
                tag = runAt.stage();
            } else if (attribute instanceof NewAssetAttribute asset) {
                newAsset = asset;
            } else if (attribute instanceof ErrorNode error) {
                throw erroneous(error);
            }
        }
        boolean runs = nested ? tag == null || tag.equals(stage) : Objects.equals(tag, stage);
        if (!runs) {
            skipped(block, "it runs at stage " + (tag == null ? "<default>" : "'" + tag + "'"));
            return;
        }
        if (tag != null) {
            stageTags.add(tag);
        }

        List<Match> matches;
        if (newAsset != null) {
            matches = engine.find(block.selector(), List.of(createAsset(newAsset, scope)));
        } else if (nested) {
            matches = engine.findWithin(block.selector(), selection.match);
        } else {
            matches = engine.find(block.selector(), roots);
        }
        for (Match match : matches) {
            apply(block, match, scope);
        }
    }

    private Selectable createAsset(NewAssetAttribute newAsset, Scope scope) {
        if (environment.assetCreator() == null) {
            throw new ResolutionException(newAsset.coordinate(), "This host cannot create new assets");
        }
        List<DataValue> arguments = new ArrayList<>();
        for (Expression argument : newAsset.arguments()) {
            arguments.add(evaluate(argument, scope));
        }
        try {
            return environment.assetCreator().create(arguments);
        } catch (PatchRuntimeException e) {
            throw e.locate(newAsset.coordinate());
        }
    }

    private void apply(SelectionBlock block, Match match, Scope scope) {
        Selectable element = match.element();
        if (log.isDebugEnabled()) {
            log.debug(block.coordinate() + ": applying to " + element.elementType() + " '" + element.name() + "'");
        }
        Selection previous = selection;
        Selection current = new Selection(match, element.openModification());
        Scope body = scope.selectionChild();
        body.declare("value", element.getValue());
        body.declare("name", DataValue.of(element.name()));
        body.declare("element_type", DataValue.of(element.elementType()));
        selection = current;
        try {
            for (Statement statement : block.body()) {
                expectNoReturn(execute(statement, body), statement);
            }
        } finally {
            selection = previous;
            current.modifiable.complete();
            if (current.edited) {
                modifiedElements++;
            }
        }
    }

    private void skipped(SelectionBlock block, String reason) {
        if (log.isDebugEnabled()) {
            log.debug(block.coordinate() + ": skipping selection block, " + reason);
        }
    }

    private Selection requireSelection(Statement statement) {
        if (selection == null) {
            throw new ResolutionException(statement.coordinate(),
                statement.type() + " is only valid inside a selection block");
        }
        return selection;
    }

    private void includeMixin(MixinInclude include, Scope scope) {
        MixinDefinition mixin = mixins.get(include.mixin());
        if (mixin == null) {
            mixin = environment.mixin(include.mixin());
        }
        if (mixin == null) {
            throw new ResolutionException(include.coordinate(), "Unknown mixin '@" + include.mixin() + "'");
        }
        Arguments arguments = arguments(include.arguments(), null, scope);
        Scope body = scope.child();
        bind("mixin '@" + mixin.name() + "'", include.coordinate(), mixin.arguments(),
            arguments.values(include.coordinate(), "mixin '@" + mixin.name() + "'"), arguments.named, body);
        for (Statement statement : mixin.body()) {
            expectNoReturn(execute(statement, body), statement);
        }
    }

    // ==================== Fields and indexers ====================

    private void assignField(Field field, Scope scope) {
        Selection current = requireSelection(field);
        DataValue existing = current.modifiable.getFieldValue(field.key());
        DataValue updated;
        if (field.indexer() == null) {
            updated = evaluateField(field.value(), scope, existing);
        } else {
            if (existing == null) {
                throw new ResolutionException(field.coordinate(), "Field '" + field.key() + "' does not exist");
            }
            updated = replaceIndexed(existing, field.indexer(), item -> evaluateField(field.value(), scope, item));
        }
        current.modifiable.setFieldValue(field.key(), updated);
        current.edited = true;
    }

    private DataValue evaluateField(Expression value, Scope scope, DataValue existing) {
        FieldTarget previous = fieldTarget;
        fieldTarget = new FieldTarget(existing);
        try {
            return evaluate(value, scope);
        } finally {
            fieldTarget = previous;
        }
    }

    /**
     * Replaces the item an indexer addresses inside {@code container}; a deletion removes it.
     */
    private DataValue replaceIndexed(DataValue container, Indexer indexer, Function<DataValue, DataValue> update) {
        if (indexer instanceof ErrorNode error) {
            throw erroneous(error);
        }
        if (container instanceof DataValue.ListValue list) {
            int index = locate(list, indexer);
            DataValue replacement = update.apply(list.get(index));
            return replacement.isDeletion() ? list.without(index) : list.with(index, replacement);
        }
        if (container instanceof DataValue.ObjectValue object) {
            String key;
            if (indexer instanceof StringIndexer string) {
                key = string.key();
            } else if (indexer instanceof ElementIndexer element) {
                key = element.elementType();
            } else {
                throw new PatchTypeException(indexer.coordinate(), "Cannot apply " + indexer.type() + " to an object");
            }
            DataValue item = object.get(key);
            if (item == null) {
                throw new ResolutionException(indexer.coordinate(), "No entry keyed '" + key + "'");
            }
            DataValue replacement = update.apply(item);
            return replacement.isDeletion() ? object.without(key) : object.with(key, replacement);
        }
        throw new PatchTypeException(indexer.coordinate(), "Cannot index into a " + container.kind().displayName());
    }

    private int locate(DataValue.ListValue list, Indexer indexer) {
        if (indexer instanceof NumberIndexer number) {
            if (Long.compareUnsigned(number.index(), list.size()) >= 0) {
                throw new ResolutionException(indexer.coordinate(), "Index " + Long.toUnsignedString(number.index())
                    + " is out of range for a list of " + list.size() + " item(s)");
            }
            return (int) number.index();
        }
        if (indexer instanceof ElementIndexer element) {
            DataValue wanted = DataValue.of(element.elementType());
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i) instanceof DataValue.ObjectValue item
                    && wanted.equals(item.get(environment.elementTypeKey()))) {
                    return i;
                }
            }
            throw new ResolutionException(indexer.coordinate(), "No '" + element.elementType() + "' element found");
        }
        if (indexer instanceof ClassIndexer clazz) {
            DataValue wanted = DataValue.of(clazz.className());
            for (int i = 0; i < list.size(); i++) {
                if (list.get(i) instanceof DataValue.ObjectValue item
                    && item.get(environment.classesKey()) instanceof DataValue.ListValue classes
                    && classes.items().contains(wanted)) {
                    return i;
                }
            }
            throw new ResolutionException(indexer.coordinate(), "No element with class '" + clazz.className() + "' found");
        }
        throw new PatchTypeException(indexer.coordinate(), "Cannot apply " + indexer.type() + " to a list");
    }

    // ==================== Loops ====================

    private Flow forLoop(For loop, Scope scope) {
        long from = integer(loop.from(), scope, "for loop bound");
        long to = integer(loop.to(), scope, "for loop bound");
        long step = from <= to ? 1 : -1;
        long iterations = 0;
        for (long i = from; loop.inclusive() ? i != to + step : i != to; i += step) {
            checkLimit(++iterations, loop);
            Scope body = scope.child();
            body.declare(loop.index(), DataValue.of(i));
            Flow flow = execute(loop.body(), body);
            if (flow instanceof Flow.Return) {
                return flow;
            }
        }
        return Flow.CONTINUE;
    }

    private Flow eachLoop(Each loop, Scope scope) {
        DataValue iterable = evaluate(loop.iterable(), scope);
        long iterations = 0;
        if (iterable instanceof DataValue.ListValue list) {
            for (int i = 0; i < list.size(); i++) {
                checkLimit(++iterations, loop);
                Flow flow = eachIteration(loop, scope, DataValue.of(i), list.get(i));
                if (flow instanceof Flow.Return) {
                    return flow;
                }
            }
        } else if (iterable instanceof DataValue.ObjectValue object) {
            for (Map.Entry<String, DataValue> entry : object.entries().entrySet()) {
                checkLimit(++iterations, loop);
                Flow flow = eachIteration(loop, scope, DataValue.of(entry.getKey()), entry.getValue());
                if (flow instanceof Flow.Return) {
                    return flow;
                }
            }
        } else {
            throw new PatchTypeException(loop.iterable().coordinate(),
                "Cannot iterate over a " + iterable.kind().displayName());
        }
        return Flow.CONTINUE;
    }

    private Flow eachIteration(Each loop, Scope scope, DataValue key, DataValue value) {
        Scope body = scope.child();
        if (loop.key() != null) {
            body.declare(loop.key(), key);
        }
        body.declare(loop.value(), value);
        return execute(loop.body(), body);
    }

    private Flow whileLoop(While loop, Scope scope) {
        long iterations = 0;
        while (DataValues.isTruthy(evaluate(loop.condition(), scope))) {
            checkLimit(++iterations, loop);
            Flow flow = execute(loop.body(), scope.child());
            if (flow instanceof Flow.Return) {
                return flow;
            }
        }
        return Flow.CONTINUE;
    }

    private void checkLimit(long iterations, Statement loop) {
        if (iterations > environment.loopLimit()) {
            throw new PatchRuntimeException(DiagnosticKind.LIMIT, loop.coordinate(),
                "Loop exceeded " + environment.loopLimit() + " iterations");
        }
    }

    // ==================== Expressions ====================

    DataValue evaluate(Expression expression, Scope scope) {
        try {
            return evaluateUnlocated(expression, scope);
        } catch (PatchRuntimeException e) {
            throw e.locate(expression.coordinate());
        }
    }

    private DataValue evaluateUnlocated(Expression expression, Scope scope) {
        if (expression instanceof Literal literal) {
            return literal.value();
        }
        if (expression instanceof VariableReference reference) {
            DataValue value = ELEMENT_BINDINGS.contains(reference.name())
                ? scope.lookupSelected(reference.name())
                : null;
            if (value == null) {
                value = scope.lookupOutermost(reference.name());
            }
            if (value == null) {
                throw new ResolutionException(reference.coordinate(), "Unknown variable '$" + reference.name() + "'");
            }
            return value;
        }
        if (expression instanceof LocalVariableReference reference) {
            DataValue value = scope.lookupInnermost(reference.name());
            if (value == null) {
                throw new ResolutionException(reference.coordinate(), "Unknown variable '$$" + reference.name() + "'");
            }
            return value;
        }
        if (expression instanceof UnaryExpression unary) {
            return ValueOperations.unary(unary.operator(), evaluate(unary.operand(), scope), unary.coordinate());
        }
        if (expression instanceof BinaryExpression binary) {
            return binary(binary, scope);
        }
        if (expression instanceof ImplicitExpression implicit) {
            return implicit(implicit, scope);
        }
        if (expression instanceof Subscript subscript) {
            return subscript(subscript, scope);
        }
        if (expression instanceof SimpleCall call) {
            return call(call.coordinate(), call.function(), null, call.arguments(), scope);
        }
        if (expression instanceof MemberCall call) {
            return call(call.coordinate(), call.function(), evaluate(call.receiver(), scope), call.arguments(), scope);
        }
        if (expression instanceof Ternary ternary) {
            return condition(ternary.condition(), scope)
                ? evaluate(ternary.whenTrue(), scope)
                : evaluate(ternary.whenFalse(), scope);
        }
        if (expression instanceof ListExpression list) {
            List<DataValue> items = new ArrayList<>(list.items().size());
            for (Expression item : list.items()) {
                items.add(evaluate(item, scope));
            }
            return DataValue.list(items);
        }
        if (expression instanceof ObjectExpression object) {
            Map<String, DataValue> entries = new LinkedHashMap<>();
            for (KeyValue entry : object.entries()) {
                entries.put(entry.key(), evaluate(entry.value(), scope));
            }
            return DataValue.object(entries);
        }
        if (expression instanceof Closure closure) {
            throw new PatchTypeException(closure.coordinate(), "A closure can only be passed as a call argument");
        }
        if (expression instanceof ErrorNode error) {
            throw erroneous(error);
        }
        throw new IllegalStateException("Unhandled expression " + expression.type());
    }

    private DataValue binary(BinaryExpression binary, Scope scope) {
        DataValue lhs = evaluate(binary.lhs(), scope);
        if (binary.operator() == BinaryOperator.AND && !DataValues.isTruthy(lhs)) {
            return DataValue.FALSE;
        }
        if (binary.operator() == BinaryOperator.OR && DataValues.isTruthy(lhs)) {
            return DataValue.TRUE;
        }
        return ValueOperations.binary(binary.operator(), lhs, evaluate(binary.rhs(), scope), binary.coordinate());
    }

    private DataValue implicit(ImplicitExpression implicit, Scope scope) {
        if (fieldTarget == null) {
            throw new ResolutionException(implicit.coordinate(),
                "Implicit '" + implicit.operator().symbol() + "' is only valid as a field value");
        }
        if (fieldTarget.existing == null) {
            throw new ResolutionException(implicit.coordinate(),
                "Implicit '" + implicit.operator().symbol() + "' needs an existing field value");
        }
        DataValue existing = fieldTarget.existing;
        return ValueOperations.binary(implicit.operator(), existing, evaluate(implicit.operand(), scope),
            implicit.coordinate());
    }

    private DataValue subscript(Subscript subscript, Scope scope) {
        DataValue target = evaluate(subscript.target(), scope);
        DataValue index = evaluate(subscript.index(), scope);
        if (target instanceof DataValue.ListValue list && index instanceof DataValue.IntValue i) {
            if (i.value() < 0 || i.value() >= list.size()) {
                throw new ResolutionException(subscript.coordinate(),
                    "Index " + i.value() + " is out of range for a list of " + list.size() + " item(s)");
            }
            return list.get((int) i.value());
        }
        if (target instanceof DataValue.StringValue string && index instanceof DataValue.IntValue i) {
            if (i.value() < 0 || i.value() >= string.value().length()) {
                throw new ResolutionException(subscript.coordinate(),
                    "Index " + i.value() + " is out of range for a string of length " + string.value().length());
            }
            return DataValue.of(String.valueOf(string.value().charAt((int) i.value())));
        }
        if (target instanceof DataValue.ObjectValue object && index instanceof DataValue.StringValue key) {
            DataValue value = object.get(key.value());
            return value != null ? value : DataValue.NONE;
        }
        throw new PatchTypeException(subscript.coordinate(), "Cannot index a " + target.kind().displayName()
            + " with a " + index.kind().displayName());
    }

    private boolean condition(Expression expression, Scope scope) {
        DataValue value = evaluate(expression, scope);
        if (value instanceof DataValue.BoolValue b) {
            return b.value();
        }
        throw new PatchTypeException(expression.coordinate(),
            "Condition must be a bool but was a " + value.kind().displayName());
    }

    private long integer(Expression expression, Scope scope, String what) {
        DataValue value = evaluate(expression, scope);
        if (value instanceof DataValue.IntValue i) {
            return i.value();
        }
        throw new PatchTypeException(expression.coordinate(),
            "A " + what + " must be an int but was a " + value.kind().displayName());
    }

    // ==================== Calls ====================

    private DataValue call(Coordinate at, String name, DataValue receiver, List<CallArgument> callArguments, Scope scope) {
        Arguments arguments = arguments(callArguments, receiver, scope);
        Defined defined = functions.get(name);
        if (defined != null) {
            String what = "function '" + name + "'";
            return invoke(at, defined.scope(), defined.definition().arguments(), defined.definition().body(),
                arguments.values(at, what), arguments.named, what);
        }
        PatchFunction function = environment.function(name);
        if (function == null) {
            throw new ResolutionException(at, "Unknown function '" + name + "'");
        }
        FieldTarget previous = fieldTarget;
        fieldTarget = null;
        try {
            return function.invoke(new Invocation(name, at, arguments.positional, arguments.named));
        } finally {
            fieldTarget = previous;
        }
    }

    private Arguments arguments(List<CallArgument> callArguments, DataValue receiver, Scope scope) {
        Arguments arguments = new Arguments();
        if (receiver != null) {
            arguments.positional.add(receiver);
        }
        for (CallArgument argument : callArguments) {
            if (argument.hasName()) {
                if (argument.value() instanceof Closure closure) {
                    throw new PatchTypeException(closure.coordinate(), "A closure cannot be passed by name");
                }
                if (arguments.named.containsKey(argument.name())) {
                    throw new ArityException(argument.coordinate(), "Argument '" + argument.name() + "' given twice");
                }
                arguments.named.put(argument.name(), evaluate(argument.value(), scope));
            } else {
                if (!arguments.named.isEmpty()) {
                    throw new ArityException(argument.coordinate(), "Positional argument after named arguments");
                }
                arguments.positional.add(argument.value() instanceof Closure closure
                    ? closure(closure, scope)
                    : evaluate(argument.value(), scope));
            }
        }
        return arguments;
    }

    private PatchClosure closure(Closure closure, Scope scope) {
        return values -> invoke(closure.coordinate(), scope, closure.arguments(), closure.body(),
            values, Map.of(), "closure");
    }

    private DataValue invoke(Coordinate at, Scope definingScope, List<Argument> parameters, List<Statement> body,
                             List<DataValue> positional, Map<String, DataValue> named, String what) {
        if (callDepth >= MAX_CALL_DEPTH) {
            throw new PatchRuntimeException(DiagnosticKind.LIMIT, at, "Calls nested deeper than " + MAX_CALL_DEPTH);
        }
        Scope frame = new Scope(definingScope);
        bind(what, at, parameters, positional, named, frame);
        FieldTarget previous = fieldTarget;
        fieldTarget = null;
        callDepth++;
        try {
            Flow flow = execute(body, frame);
            return flow instanceof Flow.Return ret ? ret.value() : DataValue.NONE;
        } finally {
            callDepth--;
            fieldTarget = previous;
        }
    }

    /**
     * Binds arguments positionally, then by name, then from defaults evaluated in {@code target}.
     */
    private void bind(String what, Coordinate at, List<Argument> parameters, List<DataValue> positional,
                      Map<String, DataValue> named, Scope target) {
        if (positional.size() > parameters.size()) {
            throw new ArityException(at, capitalize(what) + " takes at most " + parameters.size()
                + " argument(s) but was given " + positional.size());
        }
        Set<String> known = new HashSet<>();
        for (int i = 0; i < parameters.size(); i++) {
            Argument parameter = parameters.get(i);
            known.add(parameter.name());
            if (i < positional.size()) {
                if (named.containsKey(parameter.name())) {
                    throw new ArityException(at, "Argument '" + parameter.name() + "' of " + what
                        + " given both positionally and by name");
                }
                target.declare(parameter.name(), positional.get(i));
            } else if (named.containsKey(parameter.name())) {
                target.declare(parameter.name(), named.get(parameter.name()));
            } else if (parameter.hasDefault()) {
                target.declare(parameter.name(), evaluate(parameter.defaultValue(), target));
            } else {
                throw new ArityException(at, "Missing argument '" + parameter.name() + "' for " + what);
            }
        }
        for (String name : named.keySet()) {
            if (!known.contains(name)) {
                throw new ArityException(at, capitalize(what) + " has no parameter named '" + name + "'");
            }
        }
    }

    private static String capitalize(String text) {
        return Character.toUpperCase(text.charAt(0)) + text.substring(1);
    }

    private static PatchRuntimeException erroneous(ErrorNode error) {
        return new PatchRuntimeException(DiagnosticKind.SYNTAX, error.coordinate(),
            "Cannot execute an erroneous node: " + error.message());
    }

    // ==================== Per-run records ====================

    private record Defined(FunctionDefinition definition, Scope scope) {
    }

    private record FieldTarget(DataValue existing) {
    }

    private static final class Selection {
        final Match match;
        final Modifiable modifiable;
        boolean edited;

        Selection(Match match, Modifiable modifiable) {
            this.match = match;
            this.modifiable = modifiable;
        }
    }

    private static final class Arguments {
        final List<Object> positional = new ArrayList<>();
        final Map<String, DataValue> named = new LinkedHashMap<>();

        /**
         * @throws PatchTypeException if a closure was passed to something that only takes values
         */
        List<DataValue> values(Coordinate at, String what) {
            List<DataValue> values = new ArrayList<>(positional.size());
            for (Object argument : positional) {
                if (!(argument instanceof DataValue value)) {
                    throw new PatchTypeException(at, capitalize(what) + " cannot take a closure argument");
                }
                values.add(value);
            }
            return values;
        }
    }
}
