package io.macroforge.core.model;

import io.macroforge.core.spi.MacroExpander;
import java.util.Objects;

/**
 * A macro name bound to its expander, scoped to the module that defined it. The expander always
 * runs in its originating module's context, even after the binding has been required into another
 * module.
 *
 * @param name         the mangled macro name
 * @param originModule the module in which the macro was defined
 * @param expander     the expander callable
 */
public record MacroBinding(String name, String originModule, MacroExpander expander) {

    public MacroBinding {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(originModule, "originModule must not be null");
        Objects.requireNonNull(expander, "expander must not be null");
    }

    /** Returns a copy of this binding under another name, keeping the originating module. */
    public MacroBinding alias(String newName) {
        return new MacroBinding(newName, originModule, expander);
    }
}
