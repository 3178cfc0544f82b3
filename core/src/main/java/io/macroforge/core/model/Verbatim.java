package io.macroforge.core.model;

import java.util.Objects;

/**
 * Marker returned by a macro expander to ask that its result be taken as the final value without
 * further expansion. Honoured only when the caller allows verbatim results.
 *
 * @param value the node to return as-is
 */
public record Verbatim(Node value) implements MacroResult {

    public Verbatim {
        Objects.requireNonNull(value, "value must not be null");
    }
}
