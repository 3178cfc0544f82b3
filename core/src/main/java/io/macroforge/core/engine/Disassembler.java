package io.macroforge.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.macroforge.core.engine.ir.SourceRenderer;
import io.macroforge.core.error.CompileException;
import io.macroforge.core.model.CompiledUnit;
import io.macroforge.core.model.Node;
import io.macroforge.core.spi.HostCompiler;
import java.util.Objects;

/**
 * Shows what a symbolic tree compiles to without running it: either the structural IR as compact
 * JSON or the target source text.
 *
 * <p>The JSON dump depends only on the tree, never on the whitespace of the source it was read
 * from.
 */
public final class Disassembler {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HostCompiler compiler;
    private final SourceRenderer renderer;
    private final String moduleName;

    /**
     * @param compiler   compiles trees to IR
     * @param renderer   renders IR as source text
     * @param moduleName module the trees are compiled in
     */
    public Disassembler(HostCompiler compiler, SourceRenderer renderer, String moduleName) {
        this.compiler = Objects.requireNonNull(compiler, "compiler must not be null");
        this.renderer = Objects.requireNonNull(renderer, "renderer must not be null");
        this.moduleName = Objects.requireNonNull(moduleName, "moduleName must not be null");
    }

    public String moduleName() {
        return moduleName;
    }

    /** Returns the IR dump of {@code tree}. */
    public String disassemble(Node tree) {
        return disassemble(tree, false);
    }

    /**
     * @param tree    the tree to compile
     * @param codegen {@code true} for target source text, {@code false} for the IR dump
     * @throws CompileException if the tree cannot be compiled
     */
    public String disassemble(Node tree, boolean codegen) {
        return disassemble(tree, moduleName, codegen);
    }

    /** Same as {@link #disassemble(Node, boolean)}, compiling in {@code module} instead. */
    public String disassemble(Node tree, String module, boolean codegen) {
        CompiledUnit unit = compiler.compile(tree, module, false);
        if (codegen) {
            return renderer.render(unit);
        }
        try {
            return MAPPER.writeValueAsString(unit.ir());
        } catch (JsonProcessingException e) {
            throw new CompileException("Failed to serialize IR: " + e.getOriginalMessage(), e, module);
        }
    }
}
