package io.macroforge.core.model;

import java.util.Objects;

/**
 * A symbol node. The name is kept exactly as written; mangling happens at the points that need
 * a host identifier (macro lookup, module resolution, compilation).
 */
public record Symbol(String name) implements Node {

    public Symbol {
        Objects.requireNonNull(name, "name must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("symbol name must not be empty");
        }
    }

    /** Shorthand for {@code new Symbol(name)}. */
    public static Symbol of(String name) {
        return new Symbol(name);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSymbol(this);
    }

    @Override
    public String render() {
        return name;
    }

    @Override
    public String toString() {
        return name;
    }
}
