package io.macroforge.core.engine;

import io.macroforge.core.error.RequireException;
import io.macroforge.core.model.MacroBinding;
import io.macroforge.core.reader.SymbolicReader;
import io.macroforge.core.spi.Mangler;
import io.macroforge.core.spi.MacroTable;
import io.macroforge.core.spi.ReaderMacro;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the macro table of every module plus a builtin table consulted after a module's own
 * macros. Macro tables live as long as the environment; the expansion engine only reads them.
 *
 * <p>Thread-safe.
 */
public final class MacroEnvironment {

    private static final Logger LOG = LoggerFactory.getLogger(MacroEnvironment.class);

    /** Name of the module holding the builtin macros. */
    public static final String BUILTINS_MODULE = "builtins";

    private final Mangler mangler;
    private final Map<String, MacroRegistry> modules = new ConcurrentHashMap<>();
    private final MacroRegistry builtins;

    public MacroEnvironment(Mangler mangler) {
        this.mangler = Objects.requireNonNull(mangler, "mangler must not be null");
        this.builtins = new MacroRegistry(BUILTINS_MODULE, mangler);
    }

    public Mangler mangler() {
        return mangler;
    }

    /** The builtin macro table, visible from every module. */
    public MacroRegistry builtins() {
        return builtins;
    }

    /** Returns the macro table of the given module, creating an empty one on first use. */
    public MacroRegistry module(String moduleName) {
        Objects.requireNonNull(moduleName, "moduleName must not be null");
        if (BUILTINS_MODULE.equals(moduleName)) {
            return builtins;
        }
        return modules.computeIfAbsent(moduleName, name -> new MacroRegistry(name, mangler));
    }

    /** Returns {@code true} if the module has a macro table (builtins always do). */
    public boolean hasModule(String moduleName) {
        return BUILTINS_MODULE.equals(moduleName) || modules.containsKey(moduleName);
    }

    /** The macros visible from a module: its own table first, then the builtins. */
    public MacroTable tableFor(String moduleName) {
        MacroRegistry own = module(moduleName);
        return name -> {
            Optional<MacroBinding> found = own.lookup(name);
            return found.isPresent() ? found : builtins.lookup(name);
        };
    }

    /**
     * Resets a module's table to a copy of the builtin macros and reader macros, dropping anything
     * defined or required before.
     */
    public void loadBuiltins(String moduleName) {
        MacroRegistry target = module(moduleName);
        target.clear();
        builtins.bindings().forEach(target::put);
        builtins.readerMacros().forEach(target::registerReader);
        LOG.debug(
                "Builtins loaded: module={}, macros={}, readers={}",
                moduleName,
                target.size(),
                target.readerNames().size());
    }

    /**
     * Copies macros from one module's table into another's.
     *
     * <p>When the source module defines no macros at all, each explicitly named macro is taken to
     * be a submodule ({@code source.name}) whose macros are all required under the alias as
     * prefix.
     *
     * @param source      module to take macros from
     * @param target      module receiving the macros
     * @param assignments which macros to transfer
     * @param prefix      optional prefix; macros arrive as {@code prefix.alias}. May be null or
     *                    empty
     * @return {@code true} if macros were transferred, {@code false} if there was nothing to do
     *     (requiring a module into itself, or an empty source with ALL/EXPORTS)
     * @throws RequireException if the source module is unknown or lacks a named macro
     */
    public boolean require(String source, String target, Assignments assignments, String prefix) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(assignments, "assignments must not be null");

        if (source.equals(target)) {
            return false;
        }
        if (!hasModule(source)) {
            throw new RequireException("No module named '" + source + "'", target);
        }

        MacroRegistry from = module(source);
        if (from.isEmpty()) {
            if (assignments.mode() != Assignments.Mode.NAMED) {
                return false;
            }
            for (Map.Entry<String, String> entry : assignments.aliases().entrySet()) {
                String submodule = source + "." + mangler.mangle(entry.getKey());
                if (!hasModule(submodule)) {
                    throw new RequireException(
                            "Cannot import name '" + entry.getKey() + "' from '" + source + "'", target);
                }
                require(submodule, target, Assignments.all(), entry.getValue());
            }
            return true;
        }

        Map<String, String> selected = new LinkedHashMap<>();
        switch (assignments.mode()) {
            case ALL -> from.names().forEach(n -> selected.put(n, n));
            case EXPORTS -> from.exports().forEach(n -> selected.put(n, n));
            case NAMED -> selected.putAll(assignments.aliases());
        }

        String qualifier = prefix == null || prefix.isEmpty() ? "" : prefix + ".";
        MacroRegistry to = module(target);
        for (Map.Entry<String, String> entry : selected.entrySet()) {
            String name = mangler.mangle(entry.getKey());
            String alias = mangler.mangle(qualifier + entry.getValue());
            MacroBinding binding = from.lookup(name)
                    .orElseThrow(() -> new RequireException(
                            "Could not require name " + name + " from " + source, target));
            to.put(binding.alias(alias));
        }

        LOG.info("Macros required: source={}, target={}, count={}", source, target, selected.size());
        return true;
    }

    /**
     * Copies reader macros from one module into another. {@link Assignments.Mode#NAMED} entries
     * arrive under their alias; {@link Assignments.Mode#EXPORTS} is treated like ALL since reader
     * macros have no export list.
     *
     * @return {@code true} if reader macros were transferred, {@code false} when requiring a
     *     module into itself
     * @throws RequireException if the source module is unknown or lacks a named reader macro
     */
    public boolean requireReader(String source, String target, Assignments assignments) {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(assignments, "assignments must not be null");

        if (source.equals(target)) {
            return false;
        }
        if (!hasModule(source)) {
            throw new RequireException("No module named '" + source + "'", target);
        }

        MacroRegistry from = module(source);
        Map<String, String> selected = new LinkedHashMap<>();
        if (assignments.mode() == Assignments.Mode.NAMED) {
            selected.putAll(assignments.aliases());
        } else {
            from.readerNames().forEach(n -> selected.put(n, n));
        }

        MacroRegistry to = module(target);
        for (Map.Entry<String, String> entry : selected.entrySet()) {
            ReaderMacro macro = from.lookupReader(entry.getKey())
                    .orElseThrow(() -> new RequireException(
                            "Could not require name " + entry.getKey() + " from " + source, target));
            to.registerReader(entry.getValue(), macro);
        }

        LOG.info("Reader macros required: source={}, target={}, count={}", source, target, selected.size());
        return true;
    }

    /**
     * Makes a module's reader macros available to a reader.
     *
     * @param moduleName module whose reader macros to enable
     * @param reader     reader receiving them
     * @param names      ALL (or EXPORTS) for every reader macro of the module, NAMED for a
     *                   selection; aliases are ignored
     * @throws RequireException if a named reader macro is not defined in the module
     */
    public void enableReaders(String moduleName, SymbolicReader reader, Assignments names) {
        Objects.requireNonNull(reader, "reader must not be null");
        Objects.requireNonNull(names, "names must not be null");
        MacroRegistry registry = module(moduleName);
        Iterable<String> selected =
                names.mode() == Assignments.Mode.NAMED ? names.aliases().keySet() : registry.readerNames();
        for (String name : selected) {
            ReaderMacro macro = registry.lookupReader(name)
                    .orElseThrow(() -> new RequireException("Reader macro " + name + " is not defined", moduleName));
            reader.enable(name, macro);
        }
    }
}
