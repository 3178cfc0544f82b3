package io.macroforge.core.engine;

import io.macroforge.core.error.MacroExpansionException;
import io.macroforge.core.model.Literal;
import io.macroforge.core.model.Node;
import io.macroforge.core.model.Sequence;
import io.macroforge.core.model.Symbol;
import io.macroforge.core.spi.MacroExpander;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Argument shape of a macro. Expanders opt in through {@link #wrap(MacroExpander)}: the wrapped
 * expander only runs once the call's arguments match, so it can cast and index them freely.
 *
 * <p>A pattern is some required shapes, then some optional ones, then at most one shape repeated
 * for any remaining arguments. Without a rest shape, surplus arguments are rejected. Immutable.
 *
 * <pre>{@code
 * MacroPattern.of("when", Shape.ANY).rest(Shape.ANY).wrap(expander)
 * }</pre>
 */
public final class MacroPattern {

    /** What one argument must look like. */
    public enum Shape {
        ANY("form"),
        SYMBOL("symbol"),
        LITERAL("literal"),
        STRING("string"),
        SEQUENCE("sequence"),
        PAREN("parenthesized sequence"),
        BRACKET("bracketed sequence");

        private final String description;

        Shape(String description) {
            this.description = description;
        }

        boolean matches(Node node) {
            switch (this) {
                case SYMBOL:
                    return node instanceof Symbol;
                case LITERAL:
                    return node instanceof Literal;
                case STRING:
                    return node instanceof Literal literal && literal.value() instanceof String;
                case SEQUENCE:
                    return node instanceof Sequence;
                case PAREN:
                    return node instanceof Sequence seq && seq.delimiter() == Sequence.Delimiter.PAREN;
                case BRACKET:
                    return node instanceof Sequence seq && seq.delimiter() == Sequence.Delimiter.BRACKET;
                default:
                    return true;
            }
        }

        public String description() {
            return description;
        }
    }

    private final String name;
    private final List<Shape> required;
    private final List<Shape> optional;
    private final Shape rest;

    private MacroPattern(String name, List<Shape> required, List<Shape> optional, Shape rest) {
        this.name = name;
        this.required = List.copyOf(required);
        this.optional = List.copyOf(optional);
        this.rest = rest;
    }

    /** A pattern for the macro {@code name} taking exactly the given arguments. */
    public static MacroPattern of(String name, Shape... required) {
        Objects.requireNonNull(name, "name must not be null");
        return new MacroPattern(name, List.of(required), List.of(), null);
    }

    /** Adds optional trailing arguments after the required ones. */
    public MacroPattern optional(Shape... shapes) {
        if (rest != null) {
            throw new IllegalStateException("optional arguments must come before the rest shape");
        }
        List<Shape> merged = new ArrayList<>(optional);
        merged.addAll(List.of(shapes));
        return new MacroPattern(name, required, merged, null);
    }

    /** Accepts any number of further arguments of the given shape. */
    public MacroPattern rest(Shape shape) {
        return new MacroPattern(name, required, optional, Objects.requireNonNull(shape, "shape must not be null"));
    }

    public String name() {
        return name;
    }

    /**
     * Checks call arguments against this pattern.
     *
     * @param args       the arguments, head excluded
     * @param moduleName module the expansion runs in
     * @throws MacroExpansionException naming the macro and the first offending argument, with the
     *                                 call rebuilt from {@link #name()} and {@code args} as form
     */
    public void check(List<Node> args, String moduleName) {
        int min = required.size();
        int max = min + optional.size();
        if (args.size() < min) {
            throw mismatch(args, moduleName, "expected " + (min - args.size()) + " more argument(s), got end of macro call");
        }
        if (rest == null && args.size() > max) {
            throw mismatch(args, moduleName, "unexpected argument " + (max + 1) + ": " + args.get(max));
        }
        for (int i = 0; i < args.size(); i++) {
            Shape shape = shapeAt(i);
            if (!shape.matches(args.get(i))) {
                throw mismatch(
                        args,
                        moduleName,
                        "argument " + (i + 1) + " must be a " + shape.description() + ", got " + args.get(i));
            }
        }
    }

    /** Returns an expander that checks its arguments before delegating. */
    public MacroExpander wrap(MacroExpander expander) {
        Objects.requireNonNull(expander, "expander must not be null");
        return (context, args) -> {
            check(args, context.moduleName());
            return expander.expand(context, args);
        };
    }

    private Shape shapeAt(int index) {
        if (index < required.size()) {
            return required.get(index);
        }
        int opt = index - required.size();
        return opt < optional.size() ? optional.get(opt) : rest;
    }

    private MacroExpansionException mismatch(List<Node> args, String moduleName, String detail) {
        List<Node> call = new ArrayList<>(args.size() + 1);
        call.add(new Symbol(name));
        call.addAll(args);
        return new MacroExpansionException(
                "parse error for pattern macro '" + name + "': " + detail, Sequence.call(call), moduleName);
    }
}
