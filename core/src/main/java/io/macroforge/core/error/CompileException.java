package io.macroforge.core.error;

/** Thrown when a symbolic tree cannot be compiled to the structural IR. */
public final class CompileException extends ForgeException {

    private static final long serialVersionUID = 1L;

    public CompileException(String message, String moduleName) {
        super(message, moduleName, Phase.COMPILE);
    }

    public CompileException(String message, Throwable cause, String moduleName) {
        super(message, cause, moduleName, Phase.COMPILE);
    }
}
