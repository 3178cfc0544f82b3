package io.macroforge.core.model;

import java.util.Objects;

/**
 * Opaque reference to an imported host module. For the JVM provider the module object is a
 * {@link Class}; other providers may use any object.
 *
 * @param path   the dotted path the module was imported under
 * @param module the provider-specific module object
 */
public record ModuleHandle(String path, Object module) {

    public ModuleHandle {
        Objects.requireNonNull(path, "path must not be null");
        Objects.requireNonNull(module, "module must not be null");
    }

    @Override
    public String toString() {
        return "<module '" + path + "'>";
    }
}
