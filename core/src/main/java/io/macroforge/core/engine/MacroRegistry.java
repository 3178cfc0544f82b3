package io.macroforge.core.engine;

import io.macroforge.core.model.MacroBinding;
import io.macroforge.core.spi.Mangler;
import io.macroforge.core.spi.MacroExpander;
import io.macroforge.core.spi.MacroTable;
import io.macroforge.core.spi.ReaderMacro;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * The macro table of one module. Names are mangled on registration, so lookups always use the
 * mangled form of a call's head symbol. Thread-safe: registration and lookup can happen
 * concurrently.
 *
 * <p>Names starting with {@code _} are private. {@link #exports()} lists every other macro unless
 * an explicit export list was declared with {@link #declareExports(Collection)}.
 *
 * <p>Reader macros live in a second namespace of the same module. Their names are the tags written
 * after {@code #} and are not mangled.
 */
public final class MacroRegistry implements MacroTable {

    private final String moduleName;
    private final Mangler mangler;
    private final Map<String, MacroBinding> macros = new ConcurrentHashMap<>();
    private final Map<String, ReaderMacro> readerMacros = new ConcurrentHashMap<>();
    private volatile List<String> declaredExports;

    public MacroRegistry(String moduleName, Mangler mangler) {
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName must not be null");
        this.mangler = Objects.requireNonNull(mangler, "mangler must not be null");
    }

    /**
     * Defines a macro in this module. An existing macro of the same mangled name is replaced.
     *
     * @param name     the macro name as written in source
     * @param expander the expander
     * @return the stored binding
     */
    public MacroBinding register(String name, MacroExpander expander) {
        Objects.requireNonNull(name, "name must not be null");
        MacroBinding binding = new MacroBinding(mangler.mangle(name), moduleName, expander);
        macros.put(binding.name(), binding);
        return binding;
    }

    /** Stores a binding under its own name, keeping its originating module. */
    void put(MacroBinding binding) {
        macros.put(binding.name(), binding);
    }

    @Override
    public Optional<MacroBinding> lookup(String mangledName) {
        return Optional.ofNullable(macros.get(mangledName));
    }

    /** Returns {@code true} if a macro with the given mangled name is defined here. */
    public boolean contains(String mangledName) {
        return macros.containsKey(mangledName);
    }

    /** Defines a reader macro for the tag {@code #name}, replacing any previous one. */
    public void registerReader(String name, ReaderMacro macro) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(macro, "macro must not be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("reader macro name must not be empty");
        }
        readerMacros.put(name, macro);
    }

    public Optional<ReaderMacro> lookupReader(String name) {
        return Optional.ofNullable(readerMacros.get(name));
    }

    /** Snapshot of the reader macro names, sorted. */
    public Set<String> readerNames() {
        return new TreeSet<>(readerMacros.keySet());
    }

    /** Snapshot of the reader macros by name. */
    Map<String, ReaderMacro> readerMacros() {
        return Map.copyOf(readerMacros);
    }

    /** Restricts {@link #exports()} to the given names (mangled on entry). */
    public void declareExports(Collection<String> names) {
        declaredExports = names.stream().map(mangler::mangle).collect(Collectors.toUnmodifiableList());
    }

    /** The mangled names other modules receive when requiring this module's exports. */
    public Set<String> exports() {
        List<String> declared = declaredExports;
        if (declared != null) {
            return new TreeSet<>(declared);
        }
        return macros.keySet().stream().filter(n -> !n.startsWith("_")).collect(Collectors.toCollection(TreeSet::new));
    }

    /** Snapshot of all mangled macro names, sorted. */
    public Set<String> names() {
        return new TreeSet<>(macros.keySet());
    }

    /** Snapshot of all bindings. */
    Collection<MacroBinding> bindings() {
        return List.copyOf(macros.values());
    }

    /** Removes every macro, reader macros included, and any declared export list. */
    public void clear() {
        macros.clear();
        readerMacros.clear();
        declaredExports = null;
    }

    public boolean isEmpty() {
        return macros.isEmpty();
    }

    public int size() {
        return macros.size();
    }

    public String moduleName() {
        return moduleName;
    }
}
