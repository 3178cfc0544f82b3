package io.macroforge.core.spi;

import io.macroforge.core.model.Node;
import io.macroforge.core.reader.SymbolicReader;

/**
 * A read-time function bound to a {@code #name} tag. When the reader meets the tag it hands
 * itself to the macro, which reads whatever input it needs and returns the form that stands in
 * for the tagged text.
 */
@FunctionalInterface
public interface ReaderMacro {

    /**
     * @param reader the reader positioned just after the tag
     * @return the form replacing the tagged input, never {@code null}
     */
    Node read(SymbolicReader reader);
}
