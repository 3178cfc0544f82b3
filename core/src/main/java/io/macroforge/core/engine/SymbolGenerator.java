package io.macroforge.core.engine;

import io.macroforge.core.model.Symbol;
import io.macroforge.core.spi.Mangler;
import java.util.Objects;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Factory for hygienic symbols.
 *
 * <p>Every generated name starts with exactly one {@link #PREFIX}, whatever the hint contains,
 * and no two calls on the same generator ever return the same name. Names are not reproducible
 * across runs.
 *
 * <p>The counter is the only shared mutable state of the core and is guarded by an explicit lock.
 * {@link #shared()} is the process-wide instance; tests and isolated builds may construct their
 * own.
 */
public final class SymbolGenerator {

    /** Reserved prefix of every generated symbol. */
    public static final String PREFIX = "_mf_gensym_";

    private static final SymbolGenerator SHARED = new SymbolGenerator(new JavaIdentifierMangler());

    private final Lock lock = new ReentrantLock();
    private final Mangler mangler;
    private final String escapedPrefix;
    private long counter;

    public SymbolGenerator(Mangler mangler) {
        this.mangler = Objects.requireNonNull(mangler, "mangler must not be null");
        // what mangle() turns PREFIX into when the hint forces escaping
        this.escapedPrefix = "_" + mangler.escapePrefix() + PREFIX.substring(1);
    }

    /** The process-wide generator. Lives until the process exits and is never reset. */
    public static SymbolGenerator shared() {
        return SHARED;
    }

    /** Generates a symbol without a hint. */
    public Symbol gensym() {
        return gensym("");
    }

    /**
     * Generates a fresh symbol.
     *
     * @param hint readable fragment embedded in the name; may be empty or contain any characters
     * @return a symbol distinct from every symbol this generator produced before
     */
    public Symbol gensym(String hint) {
        String h = hint == null ? "" : hint;
        while (h.startsWith(PREFIX)) {
            h = h.substring(PREFIX.length());
        }

        long n = next();
        String mangled = mangler.mangle(PREFIX + h + "_" + n);
        if (mangled.startsWith(escapedPrefix)) {
            mangled = PREFIX + mangled.substring(escapedPrefix.length());
        }
        return new Symbol(mangled);
    }

    private long next() {
        lock.lock();
        try {
            return ++counter;
        } finally {
            lock.unlock();
        }
    }
}
