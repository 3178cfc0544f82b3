package io.macroforge.core.engine;

import io.macroforge.core.config.MacroforgeConfig;
import io.macroforge.core.engine.ir.SourceRenderer;
import io.macroforge.core.engine.ir.TreeCompiler;
import io.macroforge.core.engine.jvm.ClassModuleProvider;
import io.macroforge.core.model.MacroBinding;
import io.macroforge.core.model.Node;
import io.macroforge.core.reader.SymbolicReader;
import io.macroforge.core.spi.MacroExpander;
import io.macroforge.core.spi.Mangler;
import io.macroforge.core.spi.ModuleProvider;
import io.macroforge.core.spi.ReaderMacro;
import java.io.Reader;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wires the macro core together from a {@link MacroforgeConfig}.
 *
 * <p>Thread-safe as far as its parts are; the environment and the symbol generator are shared by
 * every context it hands out.
 */
public final class MacroRuntime {

    private static final Logger LOG = LoggerFactory.getLogger(MacroRuntime.class);

    private final MacroforgeConfig config;
    private final MacroEnvironment environment;
    private final SymbolGenerator symbols;
    private final QualifiedResolver resolver;
    private final MacroExpansionEngine engine;
    private final TreeCompiler compiler;
    private final Disassembler disassembler;

    /** Runtime over the JVM class path with the process-wide symbol generator. */
    public MacroRuntime(MacroforgeConfig config) {
        this(config, new ClassModuleProvider(), SymbolGenerator.shared());
    }

    public MacroRuntime(MacroforgeConfig config, ModuleProvider provider, SymbolGenerator symbols) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        this.symbols = Objects.requireNonNull(symbols, "symbols must not be null");

        Mangler mangler = new JavaIdentifierMangler();
        this.environment = new MacroEnvironment(mangler);
        this.resolver = new QualifiedResolver(provider, mangler);
        this.engine = new MacroExpansionEngine(new ExpansionBudget(config.expansionMaxSteps()));
        this.compiler = new TreeCompiler(engine, this::contextFor, config.stdlibModule());
        this.disassembler = new Disassembler(compiler, new SourceRenderer(), config.disassemblerModule());

        LOG.info(
                "Macro runtime initialized: maxSteps={}, disassemblerModule={}, stdlibModule={}",
                config.expansionMaxSteps(),
                config.disassemblerModule(),
                config.stdlibModule());
    }

    /** Expansion context for a module. */
    public ExpansionContext contextFor(String moduleName) {
        return new ExpansionContext(moduleName, environment, symbols, resolver);
    }

    /** Defines a macro in a module. */
    public MacroBinding defmacro(String moduleName, String name, MacroExpander expander) {
        return environment.module(moduleName).register(name, expander);
    }

    /** Defines a reader macro for the tag {@code #name} in a module. */
    public void defreader(String moduleName, String name, ReaderMacro macro) {
        environment.module(moduleName).registerReader(name, macro);
    }

    /** A reader over {@code source} with every reader macro of the module enabled. */
    public SymbolicReader reader(Reader source, String moduleName) {
        SymbolicReader reader = new SymbolicReader(source);
        environment.enableReaders(moduleName, reader, Assignments.all());
        return reader;
    }

    public Node macroexpand(Node form, String moduleName) {
        return engine.macroexpand(form, contextFor(moduleName));
    }

    public Node macroexpand1(Node form, String moduleName) {
        return engine.macroexpand1(form, contextFor(moduleName));
    }

    public Node expandAll(Node form, String moduleName) {
        return engine.expandAll(form, contextFor(moduleName));
    }

    /** Disassembles in the configured module. */
    public String disassemble(Node tree, boolean codegen) {
        return disassembler.disassemble(tree, codegen);
    }

    public MacroforgeConfig config() {
        return config;
    }

    public MacroEnvironment environment() {
        return environment;
    }

    public QualifiedResolver resolver() {
        return resolver;
    }

    public MacroExpansionEngine engine() {
        return engine;
    }

    public TreeCompiler compiler() {
        return compiler;
    }

    public Disassembler disassembler() {
        return disassembler;
    }
}
