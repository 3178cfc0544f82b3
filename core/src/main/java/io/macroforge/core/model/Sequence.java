package io.macroforge.core.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * An ordered sequence of nodes. {@link Delimiter#PAREN} sequences are call-shaped forms,
 * {@link Delimiter#BRACKET} sequences are literal sequences.
 *
 * @param delimiter how the sequence was written
 * @param items     the child nodes (copied, unmodifiable)
 */
public record Sequence(Delimiter delimiter, List<Node> items) implements Node {

    /** Source delimiters of a sequence. */
    public enum Delimiter {
        PAREN("(", ")"),
        BRACKET("[", "]");

        private final String open;
        private final String close;

        Delimiter(String open, String close) {
            this.open = open;
            this.close = close;
        }

        public String open() {
            return open;
        }

        public String close() {
            return close;
        }
    }

    public Sequence {
        Objects.requireNonNull(delimiter, "delimiter must not be null");
        Objects.requireNonNull(items, "items must not be null");
        items = List.copyOf(items);
    }

    /** Creates a parenthesized (call-shaped) sequence. */
    public static Sequence call(Node... items) {
        return new Sequence(Delimiter.PAREN, Arrays.asList(items));
    }

    /** Creates a parenthesized sequence from a list. */
    public static Sequence call(List<Node> items) {
        return new Sequence(Delimiter.PAREN, items);
    }

    /** Creates a bracketed (literal) sequence. */
    public static Sequence list(Node... items) {
        return new Sequence(Delimiter.BRACKET, Arrays.asList(items));
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public int size() {
        return items.size();
    }

    public Node get(int index) {
        return items.get(index);
    }

    /**
     * True when this sequence has the shape of a call: parenthesized, non-empty, headed by a
     * plain symbol.
     */
    public boolean isCallShaped() {
        return delimiter == Delimiter.PAREN && !items.isEmpty() && items.get(0) instanceof Symbol;
    }

    /** Everything after the head. Empty for an empty sequence. */
    public List<Node> tail() {
        return items.isEmpty() ? List.of() : items.subList(1, items.size());
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitSequence(this);
    }

    @Override
    public String render() {
        return items.stream().map(Node::render).collect(Collectors.joining(" ", delimiter.open(), delimiter.close()));
    }

    @Override
    public String toString() {
        return render();
    }
}
