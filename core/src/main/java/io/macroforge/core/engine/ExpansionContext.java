package io.macroforge.core.engine;

import io.macroforge.core.model.Symbol;
import io.macroforge.core.spi.Mangler;
import io.macroforge.core.spi.MacroTable;
import java.util.Objects;

/**
 * Resolution context for macro expansion: the current module plus the services a macro body may
 * use while it runs. Expanders always receive the context of the module that defined them.
 *
 * @param moduleName  the module whose macros are visible
 * @param environment the environment owning every module's macro table
 * @param symbols     the hygienic symbol generator
 * @param resolver    the qualified module resolver
 */
public record ExpansionContext(
        String moduleName, MacroEnvironment environment, SymbolGenerator symbols, QualifiedResolver resolver) {

    public ExpansionContext {
        Objects.requireNonNull(moduleName, "moduleName must not be null");
        Objects.requireNonNull(environment, "environment must not be null");
        Objects.requireNonNull(symbols, "symbols must not be null");
        Objects.requireNonNull(resolver, "resolver must not be null");
    }

    /** The macros visible from this module: its own table, then the builtins. */
    public MacroTable macros() {
        return environment.tableFor(moduleName);
    }

    /** The identifier mangling in effect. */
    public Mangler mangler() {
        return environment.mangler();
    }

    /** Shorthand for {@code symbols().gensym(hint)}. */
    public Symbol gensym(String hint) {
        return symbols.gensym(hint);
    }

    /** Returns the same context re-targeted at another module. */
    public ExpansionContext forModule(String otherModule) {
        if (otherModule.equals(moduleName)) {
            return this;
        }
        return new ExpansionContext(otherModule, environment, symbols, resolver);
    }
}
