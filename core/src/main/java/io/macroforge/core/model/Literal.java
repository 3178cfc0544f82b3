package io.macroforge.core.model;

import java.util.Objects;

/**
 * A literal value node. Supported value types are {@link String}, {@link Long}, {@link Double}
 * and {@link Boolean}; an {@link Integer} is widened to {@code Long}.
 *
 * <p>Distinct literal types never compare equal: {@code ""}, {@code 0} and {@code 0.0} are three
 * different nodes, and none of them equals an empty {@link Sequence}.
 */
public record Literal(Object value) implements Node {

    public Literal {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof Integer i) {
            value = i.longValue();
        }
        if (!(value instanceof String || value instanceof Long || value instanceof Double || value instanceof Boolean)) {
            throw new IllegalArgumentException(
                    "Unsupported literal type: " + value.getClass().getName());
        }
    }

    public static Literal of(String value) {
        return new Literal(value);
    }

    public static Literal of(long value) {
        return new Literal(value);
    }

    public static Literal of(double value) {
        return new Literal(value);
    }

    public static Literal of(boolean value) {
        return new Literal(value);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitLiteral(this);
    }

    @Override
    public String render() {
        if (value instanceof String s) {
            return quote(s);
        }
        return value.toString();
    }

    @Override
    public String toString() {
        return render();
    }

    /** Renders a string as a double-quoted literal with backslash escapes. */
    public static String quote(String s) {
        StringBuilder sb = new StringBuilder(s.length() + 2).append('"');
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            switch (c) {
                case '"' -> sb.append("\\\"");
                case '\\' -> sb.append("\\\\");
                case '\n' -> sb.append("\\n");
                case '\t' -> sb.append("\\t");
                case '\r' -> sb.append("\\r");
                default -> sb.append(c);
            }
        }
        return sb.append('"').toString();
    }
}
