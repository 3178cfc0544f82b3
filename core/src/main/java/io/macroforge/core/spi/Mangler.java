package io.macroforge.core.spi;

/**
 * The language's identifier normalization: turns a human-authored name into a valid host
 * identifier. Implementations must be pure and thread-safe. Core components treat the algorithm
 * as opaque and only rely on {@link #escapePrefix()} to recognize escaped output.
 */
public interface Mangler {

    /**
     * Normalizes a raw identifier.
     *
     * @param raw a non-empty identifier as written in source
     * @return the host-valid identifier
     */
    String mangle(String raw);

    /**
     * Reverses {@link #mangle(String)} as far as possible.
     *
     * @param mangled a mangled identifier
     * @return the readable form
     */
    String unmangle(String mangled);

    /** The prefix {@link #mangle(String)} adds to names that needed character escaping. */
    String escapePrefix();
}
