package com.datapatch.transform;

import com.datapatch.ast.*;
import com.datapatch.diagnostics.Diagnostic;
import com.datapatch.diagnostics.DiagnosticKind;
import com.datapatch.diagnostics.DiagnosticSink;
import com.datapatch.parse.ParseNode;
import com.datapatch.value.DataValue;
import org.apache.log4j.Logger;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a parse tree into the patch AST, one constructor per grammar alternative.
 *
 * <p>Transformation never throws for a malformed document. Every local problem is reported to
 * the {@link DiagnosticSink} with its coordinate, marks the transformer as {@link #errored()},
 * and is replaced by an {@link ErrorNode} so the rest of the document is still scanned. An
 * errored patch must not be executed.</p>
 *
 * <p>A transformer carries the errored flag of one document; use a new instance per document.
 * Documents may be transformed in parallel by separate instances.</p>
 */
public class Transformer {

    private static final Logger log = Logger.getLogger(Transformer.class);

    private static final Map<String, BinaryOperator> BINARY_RULES = Map.ofEntries(
        Map.entry("addition", BinaryOperator.ADD),
        Map.entry("subtraction", BinaryOperator.SUBTRACT),
        Map.entry("multiplication", BinaryOperator.MULTIPLY),
        Map.entry("division", BinaryOperator.DIVIDE),
        Map.entry("remainder", BinaryOperator.REMAINDER),
        Map.entry("equal_to", BinaryOperator.EQUAL),
        Map.entry("not_equal_to", BinaryOperator.NOT_EQUAL),
        Map.entry("lesser_than", BinaryOperator.LESS),
        Map.entry("lesser_than_equal", BinaryOperator.LESS_EQUAL),
        Map.entry("greater_than", BinaryOperator.GREATER),
        Map.entry("greater_than_equal", BinaryOperator.GREATER_EQUAL),
        Map.entry("and", BinaryOperator.AND),
        Map.entry("or", BinaryOperator.OR)
    );

    private static final Map<String, UnaryOperator> UNARY_RULES = Map.of(
        "positive", UnaryOperator.POSITIVE,
        "negative", UnaryOperator.NEGATE,
        "not", UnaryOperator.NOT
    );

    private static final Map<String, BinaryOperator> IMPLICIT_RULES = Map.of(
        "implicit_add", BinaryOperator.ADD,
        "implicit_subtract", BinaryOperator.SUBTRACT,
        "implicit_multiply", BinaryOperator.MULTIPLY,
        "implicit_divide", BinaryOperator.DIVIDE
    );

    private final DiagnosticSink sink;
    private boolean errored = false;

    public Transformer(DiagnosticSink sink) {
        this.sink = sink;
    }

    /**
     * Whether any diagnostic was reported by this transformer.
     */
    public boolean errored() {
        return errored;
    }

    /**
     * Transforms the root of a patch document.
     */
    public Patch transformPatch(ParseNode root) {
        Node node = transform(root);
        if (node instanceof Patch patch) {
            if (log.isDebugEnabled()) {
                log.debug(root.coordinate().file() + ": " + patch.statements().size()
                    + " top-level statement(s), errored=" + errored);
            }
            return patch;
        }
        ErrorNode error = node instanceof ErrorNode e ? e
            : error(root.coordinate(), "Expected a patch but found " + node.type());
        return new Patch(root.coordinate(), List.of(error));
    }

    /**
     * Transforms any parse-tree node into the corresponding AST node.
     */
    public Node transform(ParseNode node) {
        try {
            return dispatch(node);
        } catch (MalformedNodeException e) {
            return error(e.coordinate, e.getMessage());
        }
    }

    private Node dispatch(ParseNode node) {
        String rule = node.rule();
        Coordinate at = node.coordinate();
        if (BINARY_RULES.containsKey(rule)) {
            return new BinaryExpression(at, BINARY_RULES.get(rule), expression(node, "lhs"), expression(node, "rhs"));
        }
        if (UNARY_RULES.containsKey(rule)) {
            return new UnaryExpression(at, UNARY_RULES.get(rule), expression(node, "child"));
        }
        if (IMPLICIT_RULES.containsKey(rule)) {
            return new ImplicitExpression(at, IMPLICIT_RULES.get(rule), expression(node, "expr"));
        }
        return switch (rule) {
            // Top level
            case "patch" -> new Patch(at, statements(node.children()));
            case "patch_declaration" -> new PatchDeclaration(at,
                node.children().stream().map(label -> StringLiterals.unescape(text(label))).toList());
            case "import_declaration" -> new Import(at, StringLiterals.unescape(text(node, "imp")));
            case "var_decl" -> new VariableDeclaration(at, variableName(text(node, "variable")), expression(node, "val"));
            case "stage_def" -> stageDefinition(node);
            case "function_def" -> functionDefinition(node);
            case "mixin_def" -> mixinDefinition(node);
            case "top_level_conditional", "top_level_else_if",
                 "sel_level_conditional", "sel_level_else_if",
                 "fn_level_conditional", "fn_level_else_if" -> conditional(node);
            case "top_level_else_else", "sel_level_else_else", "fn_level_else_else" -> new Block(at, body(node));
            case "selection_block" -> new SelectionBlock(at,
                require(node, "attributes").children().stream().map(this::attribute).toList(),
                selector(node, "selector"),
                body(node));

            // Attributes
            case "require_mod" -> new RequireModAttribute(at, StringLiterals.unescape(text(node, "guid")));
            case "require_not_mod" -> new RequireNotModAttribute(at, StringLiterals.unescape(text(node, "guid")));
            case "run_at_stage" -> new RunAtStageAttribute(at, StringLiterals.unescape(text(node, "stage")));
            case "new_asset" -> new NewAssetAttribute(at, node.children().stream().map(this::expression).toList());

            // Selectors
            case "sel_element" -> new ElementSelector(at, text(node));
            case "sel_name" -> new NameSelector(at, strip(text(node), "#"));
            case "sel_class" -> new ClassSelector(at, strip(text(node), "."));
            case "sel_ruleset" -> new RulesetSelector(at, strip(text(node), "@"));
            case "sel_everything" -> new WildcardSelector(at);
            case "sel_without_class" -> new WithoutClassSelector(at, strip(strip(text(node), "~"), "."));
            case "sel_without_name" -> new WithoutNameSelector(at, strip(strip(text(node), "~"), "#"));
            case "sel_add_element" -> new ElementAdditionSelector(at, strip(text(node), "+"));
            case "sel_child" -> new ChildSelector(at, selector(node, "parent"), selector(node, "child"));
            case "sel_intersection" -> new IntersectionSelector(at, selector(node, "lhs"), selector(node, "rhs"));
            case "sel_combination" -> new CombinationSelector(at, selector(node, "lhs"), selector(node, "rhs"));
            case "sel_sub" -> selector(node, "internal");

            // Selection-level statements
            case "set_value" -> new SetValue(at, expression(node, "expr"));
            case "delete_value" -> new DeleteValue(at);
            case "merge_value" -> new MergeValue(at, expression(node, "expr"));
            case "element_key_field" -> new Field(at, text(node, "key"), optionalIndexer(node), expression(node, "expr"));
            case "string_key_field" -> new Field(at, StringLiterals.unescape(text(node, "key")),
                optionalIndexer(node), expression(node, "expr"));
            case "mixin_include" -> new MixinInclude(at, strip(text(node, "mixin"), "@"), callArguments(node));

            // Indexers
            case "number_indexer" -> numberIndexer(node);
            case "element_indexer" -> new ElementIndexer(at, text(node, "elem"));
            case "class_indexer" -> new ClassIndexer(at, strip(text(node, "clazz"), "."));
            case "string_indexer" -> new StringIndexer(at, StringLiterals.unescape(text(node, "key")));

            // Function-level statements
            case "fn_return" -> new Return(at, expression(node, "expr"));
            case "for_to_loop" -> forLoop(node, false);
            case "for_through_loop" -> forLoop(node, true);
            case "each_loop" -> new Each(at,
                node.hasLabel("key") ? strip(text(node, "key"), "$") : null,
                strip(text(node, "val"), "$"),
                expression(node, "iter"),
                body(node));
            case "while_loop" -> new While(at, expression(node, "cond"), body(node));

            // Expressions
            case "variable_reference" -> new VariableReference(at, strip(text(node), "$"));
            case "local_variable_reference" -> new LocalVariableReference(at, strip(text(node), "$$"));
            case "subscript" -> new Subscript(at, expression(node, "lhs"), expression(node, "rhs"));
            case "simple_call" -> new SimpleCall(at, text(node, "name"), callArguments(node));
            case "member_call" -> new MemberCall(at, expression(node, "lhs"), strip(text(node, "name"), "@"),
                callArguments(node));
            case "ternary" -> new Ternary(at, expression(node, "cond"), expression(node, "lhs"), expression(node, "rhs"));
            case "closure" -> closure(node);
            case "sub_expression" -> expression(node, "internal");

            // Literals
            case "number_value" -> number(node);
            case "string_value" -> new Literal(at, DataValue.of(StringLiterals.unescape(text(node))));
            case "boolean_true" -> new Literal(at, DataValue.TRUE);
            case "boolean_false" -> new Literal(at, DataValue.FALSE);
            case "none" -> new Literal(at, DataValue.NONE);
            case "value_deletion" -> new Literal(at, DataValue.DELETION);
            case "list_value" -> new ListExpression(at, node.children().stream().map(this::expression).toList());
            case "object_value" -> new ObjectExpression(at, keyValues(node.children()));
            case "literal_key" -> new KeyValue(at, text(node, "key"), expression(node, "val"));
            case "string_key" -> new KeyValue(at, StringLiterals.unescape(text(node, "key")), expression(node, "val"));

            // Arguments
            case "named_argument" -> new CallArgument(at, strip(text(node, "key"), "$"), expression(node, "val"));
            case "unnamed_argument" -> new CallArgument(at, expression(node, "val"));
            case "argument_without_default" -> new Argument(at, strip(text(node, "name"), "$"));
            case "argument_with_default" -> new Argument(at, strip(text(node, "name"), "$"), expression(node, "val"));

            default -> error(at, "Unknown grammar rule '" + rule + "'");
        };
    }

    private Node stageDefinition(ParseNode node) {
        Coordinate location = node.coordinate();
        String stage = StringLiterals.unescape(text(node, "stage"));
        try {
            return new StageDefinition(location, stage, Long.parseUnsignedLong(text(node, "priority")));
        } catch (NumberFormatException e) {
            return error(location, "stage priority must be an unsigned integer");
        }
    }

    private Node numberIndexer(ParseNode node) {
        Coordinate location = node.coordinate();
        try {
            return new NumberIndexer(location, Long.parseUnsignedLong(text(node, "num")));
        } catch (NumberFormatException e) {
            return error(location, "Index must be a positive integer");
        }
    }

    private Node number(ParseNode node) {
        Coordinate location = node.coordinate();
        String text = text(node);
        try {
            return new Literal(location, DataValue.of(Long.parseLong(text)));
        } catch (NumberFormatException notLong) {
            try {
                return new Literal(location, DataValue.of(Double.parseDouble(text)));
            } catch (NumberFormatException notDouble) {
                return error(location, "Numbers must be parsable as a double precision floating point number");
            }
        }
    }

    private Node functionDefinition(ParseNode node) {
        List<Argument> arguments = parameters(node);
        return new FunctionDefinition(node.coordinate(), text(node, "name"), arguments, body(node));
    }

    private Node mixinDefinition(ParseNode node) {
        List<Argument> arguments = parameters(node);
        return new MixinDefinition(node.coordinate(), strip(text(node, "name"), "@"), arguments, body(node));
    }

    private Node closure(ParseNode node) {
        List<Argument> arguments = parameters(node);
        return new Closure(node.coordinate(), arguments, body(node));
    }

    private Node conditional(ParseNode node) {
        Statement otherwise = node.hasLabel("els") ? statement(node.label("els")) : null;
        return new Conditional(node.coordinate(), expression(node, "cond"), body(node), otherwise);
    }

    private Node forLoop(ParseNode node, boolean inclusive) {
        return new For(node.coordinate(),
            strip(text(node, "idx"), "$"),
            expression(node, "start"),
            inclusive,
            expression(node, "end"),
            body(node));
    }

    // ==================== Parameter validation ====================

    /**
     * Defaults must be trailing and names unique; a violation turns the whole definition into an error.
     */
    private List<Argument> parameters(ParseNode node) {
        List<Argument> arguments = new ArrayList<>();
        for (ParseNode child : require(node, "args").children()) {
            Node transformed = transform(child);
            if (transformed instanceof Argument argument) {
                arguments.add(argument);
            } else if (!(transformed instanceof ErrorNode)) {
                error(child.coordinate(), "Expected a parameter but found " + transformed.type());
            }
        }
        Set<String> seen = new HashSet<>();
        boolean defaults = false;
        for (Argument argument : arguments) {
            if (!seen.add(argument.name())) {
                throw new MalformedNodeException(node.coordinate(),
                    "duplicate parameter name '" + argument.name() + "'");
            }
            if (argument.hasDefault()) {
                defaults = true;
            } else if (defaults) {
                throw new MalformedNodeException(node.coordinate(), "default-valued arguments must be trailing");
            }
        }
        return arguments;
    }

    // ==================== Child helpers ====================

    private List<Statement> body(ParseNode node) {
        return statements(require(node, "body").children());
    }

    private List<Statement> statements(List<ParseNode> nodes) {
        List<Statement> statements = new ArrayList<>(nodes.size());
        for (ParseNode child : nodes) {
            statements.add(statement(child));
        }
        return statements;
    }

    private Statement statement(ParseNode node) {
        Node transformed = transform(node);
        if (transformed instanceof Statement statement) {
            return statement;
        }
        return error(node.coordinate(), "Expected a statement but found " + transformed.type());
    }

    private Expression expression(ParseNode parent, String label) {
        return expression(require(parent, label));
    }

    private Expression expression(ParseNode node) {
        Node transformed = transform(node);
        if (transformed instanceof Expression expression) {
            return expression;
        }
        return error(node.coordinate(), "Expected an expression but found " + transformed.type());
    }

    private Selector selector(ParseNode parent, String label) {
        ParseNode node = require(parent, label);
        Node transformed = transform(node);
        if (transformed instanceof Selector selector) {
            return selector;
        }
        return error(node.coordinate(), "Expected a selector but found " + transformed.type());
    }

    private Attribute attribute(ParseNode node) {
        Node transformed = transform(node);
        if (transformed instanceof Attribute attribute) {
            return attribute;
        }
        return error(node.coordinate(), "Expected an attribute but found " + transformed.type());
    }

    private Indexer optionalIndexer(ParseNode parent) {
        if (!parent.hasLabel("indexer")) {
            return null;
        }
        ParseNode node = parent.label("indexer");
        Node transformed = transform(node);
        if (transformed instanceof Indexer indexer) {
            return indexer;
        }
        return error(node.coordinate(), "Expected an indexer but found " + transformed.type());
    }

    private List<CallArgument> callArguments(ParseNode node) {
        List<CallArgument> arguments = new ArrayList<>();
        for (ParseNode child : require(node, "args").children()) {
            Node transformed = transform(child);
            if (transformed instanceof CallArgument argument) {
                arguments.add(argument);
            } else if (!(transformed instanceof ErrorNode)) {
                error(child.coordinate(), "Expected a call argument but found " + transformed.type());
            }
        }
        return arguments;
    }

    private List<KeyValue> keyValues(List<ParseNode> nodes) {
        List<KeyValue> entries = new ArrayList<>();
        for (ParseNode child : nodes) {
            Node transformed = transform(child);
            if (transformed instanceof KeyValue entry) {
                entries.add(entry);
            } else if (!(transformed instanceof ErrorNode)) {
                error(child.coordinate(), "Expected a key-value pair but found " + transformed.type());
            }
        }
        return entries;
    }

    private static ParseNode require(ParseNode node, String label) {
        ParseNode child = node.label(label);
        if (child == null) {
            throw new MalformedNodeException(node.coordinate(),
                "Rule '" + node.rule() + "' is missing its '" + label + "' part");
        }
        return child;
    }

    private static String text(ParseNode node, String label) {
        return text(require(node, label));
    }

    private static String text(ParseNode node) {
        if (node.text() == null) {
            throw new MalformedNodeException(node.coordinate(), "Rule '" + node.rule() + "' carries no token text");
        }
        return node.text();
    }

    private static String variableName(String text) {
        return strip(strip(text, "$"), "$");
    }

    private static String strip(String text, String sigil) {
        return text.startsWith(sigil) ? text.substring(sigil.length()) : text;
    }

    private ErrorNode error(Coordinate location, String message) {
        sink.report(new Diagnostic(DiagnosticKind.SYNTAX, location, message));
        errored = true;
        return new ErrorNode(location, message);
    }

    /**
     * A rule node lacks a part its rule requires; the whole rule becomes an error node.
     */
    private static final class MalformedNodeException extends RuntimeException {
        private final Coordinate coordinate;

        MalformedNodeException(Coordinate coordinate, String message) {
            super(message, null, false, false);
            this.coordinate = coordinate;
        }
    }
}
