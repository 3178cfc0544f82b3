package io.macroforge.core.spi;

import io.macroforge.core.model.CompiledUnit;
import io.macroforge.core.model.Node;

/** Compiles symbolic trees into the host platform's structural intermediate representation. */
public interface HostCompiler {

    /**
     * Compiles a tree.
     *
     * @param tree         the tree to compile
     * @param moduleName   the module whose macros and context apply
     * @param importStdlib whether to inject the standard-library import into the unit
     * @return the compiled unit; never executed by the compiler
     * @throws io.macroforge.core.error.CompileException if the tree cannot be compiled
     */
    CompiledUnit compile(Node tree, String moduleName, boolean importStdlib);
}
