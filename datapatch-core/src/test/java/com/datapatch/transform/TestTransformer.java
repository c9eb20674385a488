package com.datapatch.transform;

import com.datapatch.ast.*;
import com.datapatch.diagnostics.CollectingDiagnosticSink;
import com.datapatch.diagnostics.DiagnosticKind;
import com.datapatch.parse.ParseNode;
import com.datapatch.value.DataValue;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.datapatch.ParseTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class TestTransformer {

    private final CollectingDiagnosticSink sink = new CollectingDiagnosticSink();
    private final Transformer transformer = new Transformer(sink);

    private static ParseNode stage(String priority) {
        return node("stage_def", "stage", token("\"late\""), "priority", token(priority));
    }

    private static ParseNode engineBlock() {
        ParseNode selector = node("sel_intersection",
            "lhs", leaf("sel_element", "Engine"),
            "rhs", leaf("sel_class", ".LiquidFuel"));
        ParseNode body = list("block",
            node("merge_value", "expr", list("object_value",
                node("literal_key", "key", token("ThrustMultiplier"), "val", number("2.0")))));
        return node("selection_block", "attributes", list("attributes"), "selector", selector, "body", body);
    }

    @Test
    void testTransformationIsDeterministic() {
        ParseNode tree = list("patch", stage("12"), engineBlock());

        Patch first = new Transformer(new CollectingDiagnosticSink()).transformPatch(tree);
        Patch second = new Transformer(new CollectingDiagnosticSink()).transformPatch(tree);

        assertEquals(first, second);
    }

    @Test
    void testSelectionBlock() {
        Patch patch = transformer.transformPatch(list("patch", engineBlock()));

        assertFalse(transformer.errored());
        SelectionBlock block = (SelectionBlock) patch.statements().get(0);
        IntersectionSelector selector = (IntersectionSelector) block.selector();
        assertEquals("Engine", ((ElementSelector) selector.lhs()).elementType());
        assertEquals("LiquidFuel", ((ClassSelector) selector.rhs()).className());
        MergeValue merge = (MergeValue) block.body().get(0);
        ObjectExpression object = (ObjectExpression) merge.value();
        assertEquals("ThrustMultiplier", object.entries().get(0).key());
        assertEquals(DataValue.of(2.0), ((Literal) object.entries().get(0).value()).value());
    }

    @Test
    void testStagePriorityParsesAsUnsigned() {
        Node node = transformer.transform(stage("12"));

        StageDefinition definition = assertInstanceOf(StageDefinition.class, node);
        assertEquals("late", definition.stage());
        assertEquals(12L, definition.priority());
        assertTrue(sink.isEmpty());
    }

    @Test
    void testLargeUnsignedPriority() {
        StageDefinition definition = (StageDefinition) transformer.transform(stage("18446744073709551615"));

        assertEquals("18446744073709551615", definition.priorityText());
    }

    @Test
    void testInvalidStagePriorities() {
        Patch patch = transformer.transformPatch(list("patch", stage("-1"), stage("abc")));

        assertTrue(transformer.errored());
        assertEquals(List.of("stage priority must be an unsigned integer", "stage priority must be an unsigned integer"),
            sink.messages());
        assertTrue(sink.diagnostics().stream().allMatch(d -> d.kind() == DiagnosticKind.SYNTAX));
        assertInstanceOf(ErrorNode.class, patch.statements().get(0));
        assertInstanceOf(ErrorNode.class, patch.statements().get(1));
    }

    @Test
    void testErrorsDoNotStopScanning() {
        ParseNode tree = list("patch",
            stage("abc"),
            engineBlock(),
            node("var_decl", "variable", token("$x"), "val", number("1.2.3")));

        Patch patch = transformer.transformPatch(tree);

        assertEquals(3, patch.statements().size());
        assertInstanceOf(SelectionBlock.class, patch.statements().get(1));
        assertEquals(List.of(
            "stage priority must be an unsigned integer",
            "Numbers must be parsable as a double precision floating point number"), sink.messages());
        VariableDeclaration declaration = (VariableDeclaration) patch.statements().get(2);
        assertInstanceOf(ErrorNode.class, declaration.value());
    }

    @Test
    void testNumberLiterals() {
        assertEquals(DataValue.of(7L), ((Literal) transformer.transform(number("7"))).value());
        assertEquals(DataValue.of(1.5), ((Literal) transformer.transform(number("1.5"))).value());
        assertEquals(DataValue.of(1e3), ((Literal) transformer.transform(number("1e3"))).value());
        assertFalse(transformer.errored());
    }

    @Test
    void testNumberIndexer() {
        ParseNode good = node("element_key_field",
            "key", token("stages"),
            "indexer", node("number_indexer", "num", token("2")),
            "expr", number("1"));
        ParseNode bad = node("element_key_field",
            "key", token("stages"),
            "indexer", node("number_indexer", "num", token("-2")),
            "expr", number("1"));

        Field field = (Field) transformer.transform(good);
        assertEquals(2L, ((NumberIndexer) field.indexer()).index());
        assertFalse(transformer.errored());

        Field broken = (Field) transformer.transform(bad);
        assertInstanceOf(ErrorNode.class, broken.indexer());
        assertEquals(List.of("Index must be a positive integer"), sink.messages());
    }

    @Test
    void testOtherIndexers() {
        Field element = (Field) transformer.transform(node("element_key_field",
            "key", token("modules"),
            "indexer", node("element_indexer", "elem", token("Engine")),
            "expr", number("1")));
        Field clazz = (Field) transformer.transform(node("string_key_field",
            "key", token("'modules'"),
            "indexer", node("class_indexer", "clazz", token(".fuel")),
            "expr", number("1")));

        assertEquals("Engine", ((ElementIndexer) element.indexer()).elementType());
        assertEquals("modules", clazz.key());
        assertEquals("fuel", ((ClassIndexer) clazz.indexer()).className());
    }

    @Test
    void testStringLiteralsAreUnescaped() {
        Literal literal = (Literal) transformer.transform(string("\"tab\\there\\n\\u0041\""));

        assertEquals(DataValue.of("tab\there\nA"), literal.value());
    }

    @Test
    void testSigilsAreStripped() {
        assertEquals("mass", ((VariableReference) transformer.transform(leaf("variable_reference", "$mass"))).name());
        LocalVariableReference local = (LocalVariableReference) transformer.transform(leaf("local_variable_reference", "$$i"));
        assertEquals("i", local.name());
        assertEquals("fuel", ((WithoutClassSelector) transformer.transform(leaf("sel_without_class", "~.fuel"))).className());
        assertEquals("E1", ((WithoutNameSelector) transformer.transform(leaf("sel_without_name", "~#E1"))).name());
        assertEquals("Tank", ((ElementAdditionSelector) transformer.transform(leaf("sel_add_element", "+Tank"))).elementType());
        assertEquals("engines", ((RulesetSelector) transformer.transform(leaf("sel_ruleset", "@engines"))).ruleset());
    }

    @Test
    void testConditionalChain() {
        ParseNode tree = node("top_level_conditional",
            "cond", list("boolean_false"),
            "body", list("block"),
            "els", node("top_level_else_if",
                "cond", list("boolean_true"),
                "body", list("block", node("var_decl", "variable", token("$a"), "val", number("1"))),
                "els", node("top_level_else_else", "body", list("block"))));

        Conditional first = (Conditional) transformer.transform(tree);
        Conditional second = (Conditional) first.otherwise();

        assertEquals(DataValue.FALSE, ((Literal) first.condition()).value());
        assertEquals(1, second.body().size());
        assertInstanceOf(Block.class, second.otherwise());
        assertFalse(transformer.errored());
    }

    @Test
    void testDefaultsMustBeTrailing() {
        ParseNode args = list("args",
            node("argument_with_default", "name", token("$a"), "val", number("1")),
            node("argument_without_default", "name", token("$b")));
        ParseNode definition = node("function_def", "name", token("f"), "args", args, "body", list("block"));

        Node node = transformer.transform(definition);

        assertInstanceOf(ErrorNode.class, node);
        assertEquals(List.of("default-valued arguments must be trailing"), sink.messages());
    }

    @Test
    void testTrailingDefaultsAccepted() {
        ParseNode args = list("args",
            node("argument_without_default", "name", token("$a")),
            node("argument_with_default", "name", token("$b"), "val", number("1")));
        ParseNode definition = node("function_def", "name", token("f"), "args", args,
            "body", list("block", node("fn_return", "expr", variable("$b"))));

        FunctionDefinition function = (FunctionDefinition) transformer.transform(definition);

        assertEquals(2, function.arguments().size());
        assertFalse(function.arguments().get(0).hasDefault());
        assertTrue(function.arguments().get(1).hasDefault());
        assertInstanceOf(Return.class, function.body().get(0));
    }

    @Test
    void testDuplicateParameters() {
        ParseNode args = list("args",
            node("argument_without_default", "name", token("$a")),
            node("argument_without_default", "name", token("$a")));

        assertInstanceOf(ErrorNode.class,
            transformer.transform(node("closure", "args", args, "body", list("block"))));
        assertEquals(List.of("duplicate parameter name 'a'"), sink.messages());
    }

    @Test
    void testMalformedTreesBecomeErrorNodes() {
        Node unknown = transformer.transform(list("spaceship"));
        Node missing = transformer.transform(node("set_value"));
        Node misplaced = transformer.transform(node("set_value", "expr", leaf("sel_class", ".fuel")));

        assertInstanceOf(ErrorNode.class, unknown);
        assertInstanceOf(ErrorNode.class, missing);
        assertInstanceOf(ErrorNode.class, ((SetValue) misplaced).value());
        assertEquals(List.of(
            "Unknown grammar rule 'spaceship'",
            "Rule 'set_value' is missing its 'expr' part",
            "Expected an expression but found ClassSelector"), sink.messages());
    }

    @Test
    void testImplicitOperatorsAndCalls() {
        ImplicitExpression implicit = (ImplicitExpression) transformer.transform(
            node("implicit_multiply", "expr", number("2")));
        MemberCall call = (MemberCall) transformer.transform(node("member_call",
            "lhs", variable("$list"),
            "name", token("append"),
            "args", list("args", node("named_argument", "key", token("$item"), "val", number("3")))));

        assertEquals(BinaryOperator.MULTIPLY, implicit.operator());
        assertEquals("append", call.function());
        assertEquals("item", call.arguments().get(0).name());
    }

    @Test
    void testPatchDeclarationAndImport() {
        Patch patch = transformer.transformPatch(list("patch",
            list("patch_declaration", token("\"parts\""), token("\"resources\"")),
            node("import_declaration", "imp", token("'common'"))));

        assertEquals(List.of("parts", "resources"), ((PatchDeclaration) patch.statements().get(0)).labels());
        assertEquals("common", ((Import) patch.statements().get(1)).library());
    }
}
