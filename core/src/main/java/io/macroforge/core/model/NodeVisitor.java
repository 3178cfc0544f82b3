package io.macroforge.core.model;

/**
 * Visitor over the closed set of node kinds. Every visitor handles every kind, so adding a node
 * kind breaks compilation wherever nodes are dispatched on.
 *
 * @param <R> the result type
 */
public interface NodeVisitor<R> {

    R visitSymbol(Symbol symbol);

    R visitSequence(Sequence sequence);

    R visitLiteral(Literal literal);
}
