package io.macroforge.core.model;

/**
 * A node of the symbolic tree: the code-as-data form of a program before compilation.
 *
 * <p>The variant set is closed. Code that dispatches on node shape handles exactly
 * {@link Symbol}, {@link Sequence} and {@link Literal}; adding a kind is a compile-time checked
 * change everywhere.
 *
 * <p>Nodes are immutable. Expansion builds new nodes and never mutates existing ones.
 */
public sealed interface Node extends MacroResult permits Symbol, Sequence, Literal {

    /** Renders this node back to s-expression source text. */
    String render();

    /** Dispatches to the visitor method for this node's kind. */
    <R> R accept(NodeVisitor<R> visitor);
}
