package io.macroforge.core.engine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Which macros a {@link MacroEnvironment#require} call transfers.
 *
 * @param mode    which macros to take
 * @param aliases for {@link Mode#NAMED}: macro name to alias, in declaration order
 */
public record Assignments(Mode mode, Map<String, String> aliases) {

    public enum Mode {
        ALL,
        EXPORTS,
        NAMED
    }

    private static final Assignments ALL = new Assignments(Mode.ALL, Map.of());
    private static final Assignments EXPORTS = new Assignments(Mode.EXPORTS, Map.of());

    public Assignments {
        Objects.requireNonNull(mode, "mode must not be null");
        Objects.requireNonNull(aliases, "aliases must not be null");
        aliases = Collections.unmodifiableMap(new LinkedHashMap<>(aliases));
    }

    /** Every macro of the source module, private ones included. */
    public static Assignments all() {
        return ALL;
    }

    /** The source module's exported macros. */
    public static Assignments exports() {
        return EXPORTS;
    }

    /** The named macros, each under its own name. */
    public static Assignments names(String... names) {
        Map<String, String> map = new LinkedHashMap<>();
        for (String name : names) {
            map.put(name, name);
        }
        return new Assignments(Mode.NAMED, map);
    }

    /** The named macros under the given aliases. */
    public static Assignments aliased(Map<String, String> nameToAlias) {
        return new Assignments(Mode.NAMED, nameToAlias);
    }
}
