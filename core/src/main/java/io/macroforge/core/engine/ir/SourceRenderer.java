package io.macroforge.core.engine.ir;

import com.fasterxml.jackson.databind.JsonNode;
import io.macroforge.core.error.CompileException;
import io.macroforge.core.model.CompiledUnit;
import io.macroforge.core.model.Literal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders the structural IR as target source text, one statement per line. Binary operators are
 * parenthesized only where precedence requires it, so {@code (* (+ 1 2) 3)} renders as
 * {@code (1 + 2) * 3}.
 */
public final class SourceRenderer {

    private static final Map<String, String> SYMBOLS = Map.ofEntries(
            Map.entry("Add", "+"),
            Map.entry("Sub", "-"),
            Map.entry("Mult", "*"),
            Map.entry("Div", "/"),
            Map.entry("Mod", "%"),
            Map.entry("UAdd", "+"),
            Map.entry("USub", "-"),
            Map.entry("Eq", "=="),
            Map.entry("NotEq", "!="),
            Map.entry("Lt", "<"),
            Map.entry("Gt", ">"),
            Map.entry("LtE", "<="),
            Map.entry("GtE", ">="));

    private static final int PREC_COMPARE = 0;
    private static final int PREC_UNARY = 3;
    private static final int PREC_ATOM = 4;

    /** Renders a compiled unit. */
    public String render(CompiledUnit unit) {
        List<String> lines = new ArrayList<>();
        for (JsonNode statement : unit.ir().path("body")) {
            lines.add(statement(statement, unit.moduleName()));
        }
        return String.join("\n", lines);
    }

    private String statement(JsonNode node, String moduleName) {
        String type = node.path(TreeCompiler.TYPE).asText();
        return switch (type) {
            case "Expr" -> expression(node.get("value"), moduleName);
            case "ImportFrom" -> "import " + node.get("module").asText() + ".*";
            default -> throw new CompileException("Unknown statement type: " + type, moduleName);
        };
    }

    private String expression(JsonNode node, String moduleName) {
        String type = node.path(TreeCompiler.TYPE).asText();
        switch (type) {
            case "Constant": {
                JsonNode value = node.get("value");
                if (value.isTextual()) {
                    return Literal.quote(value.asText());
                }
                return value.isIntegralNumber() && !value.canConvertToInt() ? value.asText() + "L" : value.asText();
            }
            case "Name":
                return node.get("id").asText();
            case "BinOp": {
                int prec = precedence(node);
                String left = operand(node.get("left"), prec, false, moduleName);
                String right = operand(node.get("right"), prec, true, moduleName);
                return left + " " + symbol(node, moduleName) + " " + right;
            }
            case "Compare": {
                String left = operand(node.get("left"), PREC_COMPARE, true, moduleName);
                String right = operand(node.get("right"), PREC_COMPARE, true, moduleName);
                return left + " " + symbol(node, moduleName) + " " + right;
            }
            case "UnaryOp": {
                String operand = operand(node.get("operand"), PREC_UNARY, false, moduleName);
                // "--x" and "--5" would lex as a decrement
                if (operand.startsWith("-") || operand.startsWith("+")) {
                    operand = "(" + operand + ")";
                }
                return symbol(node, moduleName) + operand;
            }
            case "Call": {
                String func = operand(node.get("func"), PREC_ATOM, false, moduleName);
                return func + "(" + joined(node.get("args"), moduleName) + ")";
            }
            case "List":
                return "List.of(" + joined(node.get("elts"), moduleName) + ")";
            default:
                throw new CompileException("Unknown expression type: " + type, moduleName);
        }
    }

    /**
     * Renders a child expression, adding parentheses when it binds looser than its parent (or as
     * loosely, on the right of a left-associative operator).
     */
    private String operand(JsonNode child, int parentPrec, boolean rightSide, String moduleName) {
        String text = expression(child, moduleName);
        int prec = precedence(child);
        boolean wrap = prec < parentPrec || (rightSide && prec == parentPrec);
        return wrap ? "(" + text + ")" : text;
    }

    private String joined(JsonNode items, String moduleName) {
        List<String> parts = new ArrayList<>();
        for (JsonNode item : items) {
            parts.add(expression(item, moduleName));
        }
        return String.join(", ", parts);
    }

    private static String symbol(JsonNode node, String moduleName) {
        String op = node.path("op").asText();
        String symbol = SYMBOLS.get(op);
        if (symbol == null) {
            throw new CompileException("Unknown operator: " + op, moduleName);
        }
        return symbol;
    }

    private static int precedence(JsonNode node) {
        switch (node.path(TreeCompiler.TYPE).asText()) {
            case "Compare":
                return PREC_COMPARE;
            case "BinOp":
                String op = node.path("op").asText();
                return op.equals("Add") || op.equals("Sub") ? 1 : 2;
            case "UnaryOp":
                return PREC_UNARY;
            default:
                return PREC_ATOM;
        }
    }
}
