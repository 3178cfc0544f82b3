package io.macroforge.core.reader;

import io.macroforge.core.error.EndOfInputException;
import io.macroforge.core.error.ForgeException;
import io.macroforge.core.error.ReaderException;
import io.macroforge.core.model.Literal;
import io.macroforge.core.model.Node;
import io.macroforge.core.model.Sequence;
import io.macroforge.core.model.Symbol;
import io.macroforge.core.spi.ReaderMacro;
import java.io.Closeable;
import java.io.IOException;
import java.io.PushbackReader;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads symbolic trees from source text, one top-level form per {@link #read()} call.
 *
 * <p>Syntax: {@code ( )} and {@code [ ]} sequences, double-quoted strings with {@code \" \\ \n \t
 * \r} escapes, integers, floats, {@code true}/{@code false}, symbols, {@code ;} line comments and
 * {@code 'x} as shorthand for {@code (quote x)}. Commas count as whitespace.
 *
 * <p>{@code #name} hands the reader to the reader macro enabled under {@code name}, which reads
 * the input following the tag and returns the form to use in its place.
 *
 * <p>Not thread-safe.
 */
public final class SymbolicReader implements Closeable {

    private static final Pattern INT_PAT = Pattern.compile("[-+]?[0-9]+");
    private static final Pattern FLOAT_PAT = Pattern.compile("[-+]?[0-9]+(\\.[0-9]*)?([eE][-+]?[0-9]+)?|[-+]?\\.[0-9]+");

    private final PushbackReader in;
    private final Map<String, ReaderMacro> readerMacros = new HashMap<>();
    private int offset;

    public SymbolicReader(Reader reader) {
        this.in = new PushbackReader(Objects.requireNonNull(reader, "reader must not be null"));
    }

    /** Creates a reader over a string. */
    public static SymbolicReader of(String source) {
        return new SymbolicReader(new StringReader(source));
    }

    /** Enables a reader macro for the tag {@code #name}, replacing any previous one. */
    public void enable(String name, ReaderMacro macro) {
        Objects.requireNonNull(name, "name must not be null");
        readerMacros.put(name, Objects.requireNonNull(macro, "macro must not be null"));
    }

    /** Returns {@code true} if a reader macro is enabled for {@code #name}. */
    public boolean isEnabled(String name) {
        return readerMacros.containsKey(name);
    }

    /**
     * Reads the next top-level form.
     *
     * @throws EndOfInputException if the input ends before a complete form, including when no form
     *                             is left at all
     * @throws ReaderException     for malformed input
     */
    public Node read() {
        int ch = skipBlank();
        if (ch == -1) {
            throw new EndOfInputException("End of input");
        }
        return readForm(ch);
    }

    /** Reads every remaining form. A form cut off by the end of input still raises. */
    public List<Node> readAll() {
        List<Node> forms = new ArrayList<>();
        for (int ch = skipBlank(); ch != -1; ch = skipBlank()) {
            forms.add(readForm(ch));
        }
        return forms;
    }

    @Override
    public void close() throws IOException {
        in.close();
    }

    private Node readForm(int ch) {
        switch (ch) {
            case '(':
                return readSequence(Sequence.Delimiter.PAREN);
            case '[':
                return readSequence(Sequence.Delimiter.BRACKET);
            case ')':
            case ']':
                throw new ReaderException("Unexpected '" + (char) ch + "'", offset - 1);
            case '"':
                return readString();
            case '\'': {
                int next = skipBlank();
                if (next == -1) {
                    throw new EndOfInputException("End of input after quote");
                }
                return Sequence.call(new Symbol("quote"), readForm(next));
            }
            case '#':
                return readTagged();
            default:
                return readAtom(ch);
        }
    }

    private Sequence readSequence(Sequence.Delimiter delimiter) {
        int start = offset - 1;
        char close = delimiter.close().charAt(0);
        List<Node> items = new ArrayList<>();
        while (true) {
            int ch = skipBlank();
            if (ch == -1) {
                throw new EndOfInputException("End of input inside sequence opened at offset " + start);
            }
            if (ch == close) {
                return new Sequence(delimiter, items);
            }
            if (ch == ')' || ch == ']') {
                throw new ReaderException(
                        "Mismatched '" + (char) ch + "' closing '" + delimiter.open() + "' opened at offset " + start,
                        offset - 1);
            }
            items.add(readForm(ch));
        }
    }

    private Node readTagged() {
        int start = offset - 1;
        StringBuilder sb = new StringBuilder();
        for (int ch = next(); ch != -1; ch = next()) {
            if (isWhitespace(ch) || isTerminator(ch)) {
                unread(ch);
                break;
            }
            sb.append((char) ch);
        }
        String name = sb.toString();
        if (name.isEmpty()) {
            throw new ReaderException("Missing reader macro name after '#'", start);
        }
        ReaderMacro macro = readerMacros.get(name);
        if (macro == null) {
            throw new ReaderException("Unknown reader macro #" + name, start);
        }

        Node form;
        try {
            form = macro.read(this);
        } catch (ForgeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ReaderException("Reader macro #" + name + " failed: " + e.getMessage(), start, e);
        }
        if (form == null) {
            throw new ReaderException("Reader macro #" + name + " returned null", start);
        }
        return form;
    }

    private Literal readString() {
        int start = offset - 1;
        StringBuilder sb = new StringBuilder();
        for (int ch = next(); ch != '"'; ch = next()) {
            if (ch == -1) {
                throw new EndOfInputException("End of input inside string opened at offset " + start);
            }
            if (ch == '\\') {
                int esc = next();
                switch (esc) {
                    case -1 -> throw new EndOfInputException("End of input inside string opened at offset " + start);
                    case 'n' -> sb.append('\n');
                    case 't' -> sb.append('\t');
                    case 'r' -> sb.append('\r');
                    case '"' -> sb.append('"');
                    case '\\' -> sb.append('\\');
                    default -> throw new ReaderException("Unsupported escape '\\" + (char) esc + "'", offset - 2);
                }
            } else {
                sb.append((char) ch);
            }
        }
        return new Literal(sb.toString());
    }

    private Node readAtom(int first) {
        StringBuilder sb = new StringBuilder().appendCodePoint(first);
        for (int ch = next(); ch != -1; ch = next()) {
            if (isWhitespace(ch) || isTerminator(ch)) {
                unread(ch);
                break;
            }
            sb.append((char) ch);
        }
        String token = sb.toString();
        if (INT_PAT.matcher(token).matches()) {
            try {
                return new Literal(Long.parseLong(token));
            } catch (NumberFormatException e) {
                throw new ReaderException("Integer out of range: " + token, offset - token.length());
            }
        }
        if (FLOAT_PAT.matcher(token).matches()) {
            return new Literal(Double.parseDouble(token));
        }
        if ("true".equals(token) || "false".equals(token)) {
            return new Literal(Boolean.parseBoolean(token));
        }
        return new Symbol(token);
    }

    /** Skips whitespace and comments, returning the first significant character or -1. */
    private int skipBlank() {
        int ch = next();
        while (true) {
            if (ch == ';') {
                while (ch != -1 && ch != '\n') {
                    ch = next();
                }
            } else if (ch != -1 && isWhitespace(ch)) {
                ch = next();
            } else {
                return ch;
            }
        }
    }

    private int next() {
        try {
            int ch = in.read();
            if (ch != -1) {
                offset++;
            }
            return ch;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private void unread(int ch) {
        try {
            in.unread(ch);
            offset--;
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static boolean isWhitespace(int ch) {
        return Character.isWhitespace(ch) || ch == ',';
    }

    private static boolean isTerminator(int ch) {
        return ch == '(' || ch == ')' || ch == '[' || ch == ']' || ch == '"' || ch == ';' || ch == '\'';
    }
}
