package com.datapatch.interpret;

import com.datapatch.InMemoryElement;
import com.datapatch.ast.*;
import com.datapatch.diagnostics.CollectingDiagnosticSink;
import com.datapatch.diagnostics.DiagnosticKind;
import com.datapatch.host.Selectable;
import com.datapatch.value.DataValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.datapatch.Ast.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestInterpreter {

    private static final Coordinate BROKEN = Coordinate.of("broken.patch", 7, 4);

    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();
    private final Interpreter interpreter = new Interpreter(PatchEnvironment.defaults(), sink);

    private static InMemoryElement liquidEngine() {
        return new InMemoryElement("Engine", "E1",
            DataValue.object("ThrustMultiplier", DataValue.of(1.0), "Name", DataValue.of("E1")), "LiquidFuel");
    }

    private static Selector liquidEngines() {
        return new IntersectionSelector(AT, element("Engine"), clazz("LiquidFuel"));
    }

    /**
     * Runs {@code statements} in a function and stores its result in field "result" of a fresh element.
     */
    private DataValue evaluateInFunction(Statement... statements) {
        InMemoryElement target = InMemoryElement.of("Probe", "p");
        PatchResult result = interpreter.run(patch(
            function("probe", List.of(), statements),
            select(element("Probe"), field("result", call("probe")))), List.of(target));
        assertTrue(result.succeeded(), () -> String.valueOf(result.error()));
        return ((DataValue.ObjectValue) target.getValue()).get("result");
    }

    @Test
    void testSetReplacesWholesale() {
        InMemoryElement engine = liquidEngine();

        PatchResult result = interpreter.run(
            patch(select(liquidEngines(), set(obj("ThrustMultiplier", lit(2.0))))), List.of(engine));

        assertTrue(result.succeeded());
        assertEquals(DataValue.object("ThrustMultiplier", DataValue.of(2.0)), engine.getValue());
        assertEquals(1, result.modifiedElements());
        assertEquals(1, engine.completedModifications());
    }

    @Test
    void testMergePreservesOtherFields() {
        InMemoryElement engine = liquidEngine();

        interpreter.run(patch(select(liquidEngines(), merge(obj("ThrustMultiplier", lit(2.0))))), List.of(engine));

        assertEquals(DataValue.object("ThrustMultiplier", DataValue.of(2.0), "Name", DataValue.of("E1")), engine.getValue());
    }

    @Test
    void testNonMatchingElementsAreUntouched() {
        InMemoryElement solid = new InMemoryElement("Engine", "S1", DataValue.object("ThrustMultiplier", DataValue.of(1.0)),
            "SolidFuel");

        PatchResult result = interpreter.run(
            patch(select(liquidEngines(), set(obj()))), List.of(solid));

        assertEquals(0, result.modifiedElements());
        assertEquals(0, solid.completedModifications());
    }

    @Test
    void testSelectionScopeBindsElement() {
        InMemoryElement engine = liquidEngine();

        interpreter.run(patch(select(liquidEngines(),
            field("Label", op(BinaryOperator.ADD, var("element_type"), var("name"))),
            field("OldThrust", new Subscript(AT, var("value"), lit("ThrustMultiplier"))))), List.of(engine));

        DataValue.ObjectValue value = (DataValue.ObjectValue) engine.getValue();
        assertEquals(DataValue.of("EngineE1"), value.get("Label"));
        assertEquals(DataValue.of(1.0), value.get("OldThrust"));
    }

    @Test
    void testForToAndThrough() {
        Statement to = new For(AT, "i", lit(0L), false, lit(3L), List.of(let("out", call("append", var("out"), local("i")))));
        Statement through = new For(AT, "i", lit(0L), true, lit(3L), List.of(let("out", call("append", var("out"), local("i")))));

        DataValue exclusive = evaluateInFunction(let("out", list()), to, ret(var("out")));
        DataValue inclusive = evaluateInFunction(let("out", list()), through, ret(var("out")));

        assertEquals(DataValue.list(DataValue.of(0L), DataValue.of(1L), DataValue.of(2L)), exclusive);
        assertEquals(DataValue.list(DataValue.of(0L), DataValue.of(1L), DataValue.of(2L), DataValue.of(3L)), inclusive);
    }

    @Test
    void testForCountsDown() {
        Statement loop = new For(AT, "i", lit(3L), false, lit(0L), List.of(let("out", call("append", var("out"), local("i")))));

        assertEquals(DataValue.list(DataValue.of(3L), DataValue.of(2L), DataValue.of(1L)),
            evaluateInFunction(let("out", list()), loop, ret(var("out"))));
    }

    @Test
    void testEachOverObjectBindsKeys() {
        Statement loop = new Each(AT, "k", "v", obj("a", lit(1L), "b", lit(2L)),
            List.of(let("keys", op(BinaryOperator.ADD, var("keys"), local("k"))),
                let("sum", op(BinaryOperator.ADD, var("sum"), local("v")))));

        DataValue result = evaluateInFunction(let("keys", lit("")), let("sum", lit(0L)), loop,
            ret(list(var("keys"), var("sum"))));

        assertEquals(DataValue.list(DataValue.of("ab"), DataValue.of(3L)), result);
    }

    @Test
    void testWhileUsesTruthiness() {
        Statement loop = new While(AT, var("n"), List.of(let("n", op(BinaryOperator.SUBTRACT, var("n"), lit(1L))),
            let("count", op(BinaryOperator.ADD, var("count"), lit(1L)))));

        assertEquals(DataValue.of(4L), evaluateInFunction(let("n", lit(4L)), let("count", lit(0L)), loop, ret(var("count"))));
    }

    @Test
    void testReturnUnwindsOneFrame() {
        FunctionDefinition firstBig = function("first_big", List.of(param("items")),
            new Each(AT, null, "x", local("items"), List.of(
                new Conditional(AT, op(BinaryOperator.GREATER, local("x"), lit(10L)), List.of(ret(local("x"))), null))),
            ret(lit(-1L)));
        InMemoryElement target = InMemoryElement.of("Probe", "p");

        interpreter.run(patch(firstBig,
            select(element("Probe"),
                field("found", op(BinaryOperator.ADD, call("first_big", list(lit(3L), lit(12L), lit(40L))), lit(1L))),
                field("missing", call("first_big", list(lit(1L)))))), List.of(target));

        assertEquals(DataValue.object("found", DataValue.of(13L), "missing", DataValue.of(-1L)), target.getValue());
    }

    @Test
    void testDefaultsAndNamedArguments() {
        FunctionDefinition add = function("add", List.of(param("a"), param("b", lit(2L))),
            ret(op(BinaryOperator.ADD, local("a"), local("b"))));
        InMemoryElement target = InMemoryElement.of("Probe", "p");

        PatchResult result = interpreter.run(patch(add, select(element("Probe"),
            field("defaulted", call("add", lit(1L))),
            field("explicit", call("add", lit(1L), lit(5L))),
            field("named", callWith("add", named("b", lit(10L)), named("a", lit(1L)))))), List.of(target));

        assertTrue(result.succeeded());
        assertEquals(DataValue.object("defaulted", DataValue.of(3L), "explicit", DataValue.of(6L), "named", DataValue.of(11L)),
            target.getValue());
    }

    @Test
    void testMissingArgumentIsArityError() {
        FunctionDefinition add = function("add", List.of(param("a"), param("b", lit(2L))), ret(local("a")));
        SimpleCall call = new SimpleCall(BROKEN, "add", List.of());

        PatchResult result = interpreter.run(patch(add, let("x", call)), List.of());

        assertFalse(result.succeeded());
        assertEquals(DiagnosticKind.ARITY, result.error().kind());
        assertEquals(BROKEN, result.error().coordinate());
        assertEquals(DiagnosticKind.ARITY, sink.diagnostics().get(0).kind());
    }

    @Test
    void testTooManyArguments() {
        FunctionDefinition one = function("one", List.of(param("a")), ret(local("a")));

        PatchResult result = interpreter.run(patch(one, let("x", call("one", lit(1L), lit(2L)))), List.of());

        assertEquals(DiagnosticKind.ARITY, result.error().kind());
    }

    @Test
    void testFailureIsolation() {
        InMemoryElement engine = liquidEngine();
        Patch failing = patch(
            select(liquidEngines(), field("Before", lit(true))),
            let("oops", new VariableReference(BROKEN, "undefined")));
        Patch succeeding = patch(select(liquidEngines(), field("After", lit(true))));

        List<PatchResult> results = interpreter.runAll(List.of(failing, succeeding), List.of(engine), null);

        assertFalse(results.get(0).succeeded());
        assertEquals(DiagnosticKind.RESOLUTION, results.get(0).error().kind());
        assertEquals(BROKEN, results.get(0).error().coordinate());
        assertTrue(results.get(1).succeeded());
        DataValue.ObjectValue value = (DataValue.ObjectValue) engine.getValue();
        assertEquals(DataValue.TRUE, value.get("Before"));
        assertEquals(DataValue.TRUE, value.get("After"));
        assertEquals(1, sink.diagnostics().size());
    }

    @Test
    void testTypeErrors() {
        PatchResult conditional = interpreter.run(patch(
            new Conditional(AT, new Literal(BROKEN, DataValue.of(1L)), List.of(), null)), List.of());
        PatchResult arithmetic = interpreter.run(patch(
            let("x", op(BinaryOperator.SUBTRACT, lit("a"), lit(1L)))), List.of());
        PatchResult division = interpreter.run(patch(
            let("x", op(BinaryOperator.DIVIDE, lit(1L), lit(0L)))), List.of());

        assertEquals(DiagnosticKind.TYPE, conditional.error().kind());
        assertEquals(BROKEN, conditional.error().coordinate());
        assertEquals(DiagnosticKind.TYPE, arithmetic.error().kind());
        assertEquals("Integer division by zero", division.error().getMessage());
    }

    @Test
    void testMixedArithmeticPromotesToFloat() {
        DataValue result = evaluateInFunction(ret(list(
            op(BinaryOperator.ADD, lit(1L), lit(0.5)),
            op(BinaryOperator.DIVIDE, lit(7L), lit(2L)),
            op(BinaryOperator.EQUAL, lit(2L), lit(2.0)),
            op(BinaryOperator.ADD, lit("a"), lit("b")))));

        assertEquals(DataValue.list(DataValue.of(1.5), DataValue.of(3L), DataValue.TRUE, DataValue.of("ab")), result);
    }

    @Test
    void testVariableResolutionOrder() {
        FunctionDefinition shadow = function("shadow", List.of(param("x")), ret(list(var("x"), local("x"))));
        InMemoryElement target = InMemoryElement.of("Probe", "p");

        interpreter.run(patch(let("x", lit("global")), shadow,
            select(element("Probe"), field("result", call("shadow", lit("param"))))), List.of(target));

        assertEquals(DataValue.list(DataValue.of("global"), DataValue.of("param")),
            ((DataValue.ObjectValue) target.getValue()).get("result"));
    }

    @Test
    void testMixins() {
        MixinDefinition boost = new MixinDefinition(AT, "boost", List.of(param("factor", lit(2.0))), List.of(
            field("ThrustMultiplier", new ImplicitExpression(AT, BinaryOperator.MULTIPLY, local("factor")))));
        InMemoryElement engine = liquidEngine();

        PatchResult result = interpreter.run(patch(boost, select(liquidEngines(),
            new MixinInclude(AT, "boost", List.of()),
            new MixinInclude(AT, "boost", List.of(new CallArgument(AT, lit(3.0)))))), List.of(engine));

        assertTrue(result.succeeded());
        assertEquals(DataValue.of(6.0), ((DataValue.ObjectValue) engine.getValue()).get("ThrustMultiplier"));
    }

    @Test
    void testUnknownMixin() {
        PatchResult result = interpreter.run(patch(select(liquidEngines(),
            new MixinInclude(BROKEN, "nope", List.of()))), List.of(liquidEngine()));

        assertEquals("Unknown mixin '@nope'", result.error().getMessage());
        assertEquals(BROKEN, result.error().coordinate());
    }

    @Test
    void testIndexedFields() {
        DataValue modules = DataValue.list(
            DataValue.object("type", DataValue.of("Engine"), "thrust", DataValue.of(10L)),
            DataValue.object("type", DataValue.of("Tank"), "classes", DataValue.list(DataValue.of("fuel")),
                "amount", DataValue.of(5L)),
            DataValue.of("extra"));
        InMemoryElement part = new InMemoryElement("Part", "P", DataValue.object("modules", modules));

        interpreter.run(patch(select(element("Part"),
            field("modules", new ElementIndexer(AT, "Engine"),
                new ObjectExpression(AT, List.of(
                    new KeyValue(AT, "type", lit("Engine")),
                    new KeyValue(AT, "thrust", lit(20L))))),
            field("modules", new ClassIndexer(AT, "fuel"), call("values", obj("x", lit(1L)))),
            field("modules", new NumberIndexer(AT, 2), lit(DataValue.DELETION)))), List.of(part));

        assertEquals(DataValue.object("modules", DataValue.list(
            DataValue.object("type", DataValue.of("Engine"), "thrust", DataValue.of(20L)),
            DataValue.list(DataValue.of(1L)))), part.getValue());
    }

    @Test
    void testMissingIndexerTarget() {
        InMemoryElement part = new InMemoryElement("Part", "P", DataValue.object("modules", DataValue.list()));

        PatchResult result = interpreter.run(patch(select(element("Part"),
            field("modules", new ElementIndexer(BROKEN, "Engine"), lit(1L)))), List.of(part));

        assertEquals(DiagnosticKind.RESOLUTION, result.error().kind());
        assertEquals(BROKEN, result.error().coordinate());
    }

    @Test
    void testImplicitOperatorOutsideField() {
        PatchResult result = interpreter.run(patch(
            let("x", new ImplicitExpression(BROKEN, BinaryOperator.ADD, lit(1L)))), List.of());

        assertEquals(DiagnosticKind.RESOLUTION, result.error().kind());
    }

    @Test
    void testRequireModAttributes() {
        Interpreter withMod = new Interpreter(PatchEnvironment.builder().activeMod("big-engines").build(), sink);
        InMemoryElement engine = liquidEngine();
        Patch patch = patch(
            select(List.of(new RequireModAttribute(AT, "big-engines")), liquidEngines(), field("Big", lit(true))),
            select(List.of(new RequireNotModAttribute(AT, "big-engines")), liquidEngines(), field("Small", lit(true))),
            select(List.of(new RequireModAttribute(AT, "missing")), liquidEngines(), field("Missing", lit(true))));

        withMod.run(patch, List.of(engine));

        DataValue.ObjectValue value = (DataValue.ObjectValue) engine.getValue();
        assertTrue(value.containsKey("Big"));
        assertFalse(value.containsKey("Small"));
        assertFalse(value.containsKey("Missing"));
    }

    @Test
    void testStageGating() {
        InMemoryElement engine = liquidEngine();
        Patch patch = patch(
            new StageDefinition(AT, "late", 12),
            select(liquidEngines(), field("Default", lit(true))),
            select(List.of(new RunAtStageAttribute(AT, "late")), liquidEngines(), field("Late", lit(true))));

        PatchResult defaultPass = interpreter.run(patch, List.of(engine));
        assertFalse(((DataValue.ObjectValue) engine.getValue()).containsKey("Late"));
        PatchResult latePass = interpreter.run(patch, List.of(engine), "late");

        DataValue.ObjectValue value = (DataValue.ObjectValue) engine.getValue();
        assertTrue(value.containsKey("Default"));
        assertTrue(value.containsKey("Late"));
        assertEquals(12L, defaultPass.stages().get("late"));
        assertTrue(defaultPass.stageTags().isEmpty());
        assertEquals(List.of("late"), List.copyOf(latePass.stageTags()));
        assertEquals(1, latePass.modifiedElements());
    }

    @Test
    void testNestedBlocksAndElementAddition() {
        InMemoryElement tank = new InMemoryElement("Tank", "T", DataValue.object("amount", DataValue.of(1L)), "fuel");
        InMemoryElement engine = InMemoryElement.of("Engine", "E").withChildren(tank);
        InMemoryElement decoy = new InMemoryElement("Tank", "D", DataValue.object("amount", DataValue.of(1L)), "fuel");

        interpreter.run(patch(select(element("Engine"),
            select(clazz("fuel"), field("amount", new ImplicitExpression(AT, BinaryOperator.ADD, lit(9L)))),
            select(new ElementAdditionSelector(AT, "Nozzle"), set(obj("size", lit(2L)))))), List.of(engine, decoy));

        assertEquals(DataValue.object("amount", DataValue.of(10L)), tank.getValue());
        assertEquals(DataValue.object("amount", DataValue.of(1L)), decoy.getValue());
        Selectable nozzle = engine.children().get(1);
        assertEquals("Nozzle", nozzle.elementType());
        assertEquals(DataValue.object("size", DataValue.of(2L)), nozzle.getValue());
    }

    @Test
    void testNestedBlockBindsInnerElement() {
        InMemoryElement tank = new InMemoryElement("Tank", "T", DataValue.object("amount", DataValue.of(5L)), "fuel");
        InMemoryElement engine = new InMemoryElement("Engine", "E", DataValue.object("thrust", DataValue.of(1L)))
            .withChildren(tank);

        PatchResult result = interpreter.run(patch(select(element("Engine"),
            select(clazz("fuel"),
                field("seenName", var("name")),
                field("seenType", var("element_type")),
                field("seenValue", var("value"))))), List.of(engine));

        assertTrue(result.succeeded(), () -> String.valueOf(result.error()));
        DataValue.ObjectValue value = (DataValue.ObjectValue) tank.getValue();
        assertEquals(DataValue.of("T"), value.get("seenName"));
        assertEquals(DataValue.of("Tank"), value.get("seenType"));
        assertEquals(DataValue.object("amount", DataValue.of(5L)), value.get("seenValue"));
    }

    @Test
    void testGlobalValueDoesNotHideSelectedElement() {
        InMemoryElement engine = liquidEngine();

        interpreter.run(patch(let("value", lit("global")),
            select(liquidEngines(), field("seen", new Subscript(AT, var("value"), lit("Name"))))), List.of(engine));

        assertEquals(DataValue.of("E1"), ((DataValue.ObjectValue) engine.getValue()).get("seen"));
    }

    @Test
    void testDeleteValue() {
        InMemoryElement engine = liquidEngine();

        interpreter.run(patch(select(liquidEngines(), new DeleteValue(AT))), List.of(engine));

        assertTrue(engine.isDeleted());
    }

    @Test
    void testHostRejection() {
        InMemoryElement engine = liquidEngine().readOnly();

        PatchResult result = interpreter.run(patch(select(liquidEngines(), new SetValue(BROKEN, obj()))), List.of(engine));

        assertEquals(DiagnosticKind.HOST_REJECTION, result.error().kind());
        assertEquals(BROKEN, result.error().coordinate());
    }

    @Test
    void testClosuresWithBuiltins() {
        Closure doubled = new Closure(AT, List.of(param("x")), List.of(ret(op(BinaryOperator.MULTIPLY, local("x"), lit(2L)))));
        Closure odd = new Closure(AT, List.of(param("x")),
            List.of(ret(op(BinaryOperator.EQUAL, op(BinaryOperator.REMAINDER, local("x"), lit(2L)), lit(1L)))));

        DataValue result = evaluateInFunction(ret(list(
            call("map", call("range", lit(4L)), doubled),
            call("filter", call("range", lit(1L), lit(6L)), odd))));

        assertEquals(DataValue.list(
            DataValue.list(DataValue.of(0L), DataValue.of(2L), DataValue.of(4L), DataValue.of(6L)),
            DataValue.list(DataValue.of(1L), DataValue.of(3L), DataValue.of(5L))), result);
    }

    @Test
    void testMemberCallPassesReceiverFirst() {
        DataValue result = evaluateInFunction(ret(new MemberCall(AT, list(lit(1L)), "append",
            List.of(new CallArgument(AT, lit(2L))))));

        assertEquals(DataValue.list(DataValue.of(1L), DataValue.of(2L)), result);
    }

    @Test
    void testLoopLimit() {
        Interpreter limited = new Interpreter(PatchEnvironment.builder().loopLimit(100).build(), sink);

        PatchResult result = limited.run(patch(new While(BROKEN, lit(true), List.of())), List.of());

        assertEquals(DiagnosticKind.LIMIT, result.error().kind());
        assertEquals(BROKEN, result.error().coordinate());
    }

    @Test
    void testNewAsset() {
        InMemoryElement created = InMemoryElement.of("Part", "generated");
        PatchEnvironment environment = PatchEnvironment.builder()
            .assetCreator(arguments -> {
                assertEquals(List.of(DataValue.of("parts"), DataValue.of("generated")), arguments);
                return created;
            })
            .build();
        Interpreter withCreator = new Interpreter(environment, sink);

        PatchResult result = withCreator.run(patch(select(
            List.of(new NewAssetAttribute(AT, List.of(lit("parts"), lit("generated")))),
            element("Part"),
            set(obj("mass", lit(1L))))), List.of());

        assertTrue(result.succeeded());
        assertEquals(DataValue.object("mass", DataValue.of(1L)), created.getValue());
    }

    @Test
    void testImportAndDeclarations() {
        Patch library = patch(function("twice", List.of(param("x")), ret(op(BinaryOperator.MULTIPLY, local("x"), lit(2L)))));
        Interpreter withLibrary = new Interpreter(PatchEnvironment.builder().library("math", library).build(), sink);
        InMemoryElement target = InMemoryElement.of("Probe", "p");

        PatchResult result = withLibrary.run(patch(
            new PatchDeclaration(AT, List.of("parts")),
            new Import(AT, "math"),
            select(element("Probe"), field("result", call("twice", lit(21L))))), List.of(target));

        assertTrue(result.succeeded());
        assertEquals(List.of("parts"), result.labels());
        assertEquals(DataValue.of(42L), ((DataValue.ObjectValue) target.getValue()).get("result"));
        PatchResult unknown = withLibrary.run(patch(new Import(BROKEN, "nope")), List.of());
        assertEquals(DiagnosticKind.RESOLUTION, unknown.error().kind());
    }

    @Test
    void testHostFunctions() {
        PatchEnvironment environment = PatchEnvironment.builder()
            .function("scale", call -> DataValue.of(call.expect(1).integer(0) * 100))
            .build();
        Interpreter withFunction = new Interpreter(environment, sink);
        InMemoryElement target = InMemoryElement.of("Probe", "p");

        withFunction.run(patch(select(element("Probe"), field("scaled", call("scale", lit(3L))))), List.of(target));

        assertEquals(DataValue.of(300L), ((DataValue.ObjectValue) target.getValue()).get("scaled"));
    }

    @Test
    void testErrorNodesAbortExecution() {
        PatchResult result = interpreter.run(patch(new ErrorNode(BROKEN, "bad")), List.of());

        assertEquals(DiagnosticKind.SYNTAX, result.error().kind());
    }
}
