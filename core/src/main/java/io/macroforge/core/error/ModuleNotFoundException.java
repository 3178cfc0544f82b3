package io.macroforge.core.error;

/**
 * Thrown when the qualified resolver cannot resolve a path. The {@link #pathForm()} tells whether
 * {@link #attemptedPath()} is the mangled path built by the attribute-chain form or the literal
 * path handed to the call form.
 */
public final class ModuleNotFoundException extends ForgeException {

    private static final long serialVersionUID = 1L;

    /** How the attempted path was produced. */
    public enum PathForm {
        /** Built from mangled attribute-chain components. */
        MANGLED,
        /** Passed verbatim by the caller. */
        LITERAL
    }

    private final String attemptedPath;
    private final PathForm pathForm;

    public ModuleNotFoundException(String attemptedPath, PathForm pathForm) {
        super("No module named '" + attemptedPath + "'", null, Phase.RESOLVE);
        this.attemptedPath = attemptedPath;
        this.pathForm = pathForm;
    }

    /** The dotted path that failed to resolve. */
    public String attemptedPath() {
        return attemptedPath;
    }

    /** Whether {@link #attemptedPath()} is mangled or literal. */
    public PathForm pathForm() {
        return pathForm;
    }
}
