package io.macroforge.core.engine.ir;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.macroforge.core.engine.ExpansionContext;
import io.macroforge.core.engine.MacroExpansionEngine;
import io.macroforge.core.error.CompileException;
import io.macroforge.core.model.CompiledUnit;
import io.macroforge.core.model.Literal;
import io.macroforge.core.model.Node;
import io.macroforge.core.model.NodeVisitor;
import io.macroforge.core.model.Sequence;
import io.macroforge.core.model.Symbol;
import io.macroforge.core.spi.HostCompiler;
import io.macroforge.core.spi.Mangler;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles symbolic trees into the structural IR: a Jackson tree of objects tagged with
 * {@code _type}.
 *
 * <p>The tree is fully macro-expanded in the target module first. Each top-level form becomes one
 * {@code Expr} statement; a {@code (do ...)} form contributes one statement per child.
 *
 * <table>
 * <caption>Node mapping</caption>
 * <tr><td>literal</td><td>{@code Constant}</td></tr>
 * <tr><td>symbol</td><td>{@code Name} with the mangled id</td></tr>
 * <tr><td>{@code (+ a b ...)}, also {@code - * / %}</td><td>left-nested {@code BinOp}</td></tr>
 * <tr><td>{@code (- a)}, {@code (+ a)}</td><td>{@code UnaryOp}</td></tr>
 * <tr><td>{@code (= a b)}, also {@code != < > <= >=}</td><td>{@code Compare}</td></tr>
 * <tr><td>other call</td><td>{@code Call}</td></tr>
 * <tr><td>{@code [a b]}</td><td>{@code List}</td></tr>
 * </table>
 */
public final class TreeCompiler implements HostCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(TreeCompiler.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Default module injected when the standard library import is requested. */
    public static final String DEFAULT_STDLIB_MODULE = "macroforge.core";

    static final String TYPE = "_type";

    private static final Map<String, String> BIN_OPS =
            Map.of("+", "Add", "-", "Sub", "*", "Mult", "/", "Div", "%", "Mod");
    private static final Map<String, String> UNARY_OPS = Map.of("+", "UAdd", "-", "USub");
    private static final Map<String, String> COMPARE_OPS =
            Map.of("=", "Eq", "!=", "NotEq", "<", "Lt", ">", "Gt", "<=", "LtE", ">=", "GtE");

    private final MacroExpansionEngine engine;
    private final Function<String, ExpansionContext> contexts;
    private final String stdlibModule;

    /**
     * @param engine       expands macros before compilation
     * @param contexts     supplies the expansion context of a module by name
     * @param stdlibModule module named by the injected standard-library import
     */
    public TreeCompiler(
            MacroExpansionEngine engine, Function<String, ExpansionContext> contexts, String stdlibModule) {
        this.engine = Objects.requireNonNull(engine, "engine must not be null");
        this.contexts = Objects.requireNonNull(contexts, "contexts must not be null");
        this.stdlibModule = Objects.requireNonNull(stdlibModule, "stdlibModule must not be null");
    }

    @Override
    public CompiledUnit compile(Node tree, String moduleName, boolean importStdlib) {
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(moduleName, "moduleName must not be null");

        ExpansionContext context = contexts.apply(moduleName);
        Node expanded = engine.expandAll(tree, context);

        ObjectNode module = typed("Module");
        ArrayNode body = module.putArray("body");
        if (importStdlib) {
            ObjectNode imp = typed("ImportFrom");
            imp.put("module", stdlibModule);
            imp.putArray("names").add("*");
            body.add(imp);
        }

        ExpressionBuilder builder = new ExpressionBuilder(context.mangler(), moduleName);
        List<Node> statements = topLevel(expanded);
        for (Node statement : statements) {
            ObjectNode expr = typed("Expr");
            expr.set("value", statement.accept(builder));
            body.add(expr);
        }

        LOG.debug("Unit compiled: module={}, statements={}, stdlib={}", moduleName, statements.size(), importStdlib);
        return new CompiledUnit(moduleName, module);
    }

    private static List<Node> topLevel(Node tree) {
        if (tree instanceof Sequence seq && seq.isCallShaped() && "do".equals(((Symbol) seq.get(0)).name())) {
            return seq.tail();
        }
        return List.of(tree);
    }

    static ObjectNode typed(String type) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put(TYPE, type);
        return node;
    }

    /** Builds the expression IR for one node. */
    private static final class ExpressionBuilder implements NodeVisitor<ObjectNode> {

        private final Mangler mangler;
        private final String moduleName;

        ExpressionBuilder(Mangler mangler, String moduleName) {
            this.mangler = mangler;
            this.moduleName = moduleName;
        }

        @Override
        public ObjectNode visitSymbol(Symbol symbol) {
            ObjectNode name = typed("Name");
            name.put("id", mangler.mangle(symbol.name()));
            return name;
        }

        @Override
        public ObjectNode visitLiteral(Literal literal) {
            ObjectNode constant = typed("Constant");
            Object value = literal.value();
            if (value instanceof String s) {
                constant.put("value", s);
            } else if (value instanceof Long l) {
                constant.put("value", l);
            } else if (value instanceof Double d) {
                constant.put("value", d);
            } else {
                constant.put("value", (Boolean) value);
            }
            return constant;
        }

        @Override
        public ObjectNode visitSequence(Sequence sequence) {
            if (sequence.delimiter() == Sequence.Delimiter.BRACKET) {
                ObjectNode list = typed("List");
                ArrayNode elts = list.putArray("elts");
                sequence.items().forEach(item -> elts.add(item.accept(this)));
                return list;
            }
            if (sequence.isEmpty()) {
                throw new CompileException("Cannot compile empty expression ()", moduleName);
            }

            List<Node> args = sequence.tail();
            if (sequence.get(0) instanceof Symbol head) {
                String op = head.name();
                if (BIN_OPS.containsKey(op) && args.size() >= 2) {
                    return binOp(BIN_OPS.get(op), args);
                }
                if (UNARY_OPS.containsKey(op) && args.size() == 1) {
                    ObjectNode unary = typed("UnaryOp");
                    unary.put("op", UNARY_OPS.get(op));
                    unary.set("operand", args.get(0).accept(this));
                    return unary;
                }
                if (COMPARE_OPS.containsKey(op) && args.size() == 2) {
                    ObjectNode compare = typed("Compare");
                    compare.set("left", args.get(0).accept(this));
                    compare.put("op", COMPARE_OPS.get(op));
                    compare.set("right", args.get(1).accept(this));
                    return compare;
                }
            }

            ObjectNode call = typed("Call");
            call.set("func", sequence.get(0).accept(this));
            ArrayNode callArgs = call.putArray("args");
            args.forEach(arg -> callArgs.add(arg.accept(this)));
            return call;
        }

        private ObjectNode binOp(String op, List<Node> operands) {
            ObjectNode left = operands.get(0).accept(this);
            for (Node operand : operands.subList(1, operands.size())) {
                ObjectNode bin = typed("BinOp");
                bin.set("left", left);
                bin.put("op", op);
                bin.set("right", operand.accept(this));
                left = bin;
            }
            return left;
        }
    }
}
