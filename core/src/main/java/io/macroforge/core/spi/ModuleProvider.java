package io.macroforge.core.spi;

import io.macroforge.core.model.ModuleHandle;
import java.util.Optional;

/**
 * Host import and reflection capability used by the qualified resolver. Implementations own any
 * caching of imported modules; callers never cache handles themselves.
 */
public interface ModuleProvider {

    /**
     * Imports the module at the given dotted path. The first import of a module runs its top-level
     * initialization.
     *
     * @param path dotted module path, used exactly as given
     * @return the module handle, or empty if no such module exists
     */
    Optional<ModuleHandle> importModule(String path);

    /**
     * Looks up an attribute of a module handle or of any previously resolved value.
     *
     * @param target a {@link ModuleHandle} or a value returned by an earlier lookup
     * @param name   the attribute name
     * @return the attribute value, or empty if the target has no such attribute
     */
    Optional<Object> getAttribute(Object target, String name);
}
