package io.macroforge.core.spi;

import io.macroforge.core.model.MacroBinding;
import java.util.Optional;

/** Read-only view of the macros visible from one module. */
@FunctionalInterface
public interface MacroTable {

    /**
     * Looks up a macro by its mangled name.
     *
     * @param mangledName the mangled head symbol of a call
     * @return the binding, or empty if no macro of that name is visible
     */
    Optional<MacroBinding> lookup(String mangledName);
}
