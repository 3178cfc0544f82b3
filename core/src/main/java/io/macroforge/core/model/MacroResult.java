package io.macroforge.core.model;

/**
 * What a macro expander hands back: either a replacement {@link Node} that expansion continues
 * on, or a {@link Verbatim} marker asking for the wrapped node to be taken as final.
 */
public sealed interface MacroResult permits Node, Verbatim {}
