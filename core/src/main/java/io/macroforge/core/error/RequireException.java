package io.macroforge.core.error;

/** Thrown when macros cannot be transferred from one module to another. */
public final class RequireException extends ForgeException {

    private static final long serialVersionUID = 1L;

    public RequireException(String message, String moduleName) {
        super(message, moduleName, Phase.EXPAND);
    }
}
