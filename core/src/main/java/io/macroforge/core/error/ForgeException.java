package io.macroforge.core.error;

/**
 * Abstract base for all macroforge language errors. Never thrown directly. Carries the phase in
 * which the error occurred and, where known, the module being processed.
 */
public abstract class ForgeException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        READ,
        EXPAND,
        RESOLVE,
        COMPILE
    }

    private final String moduleName;
    private final Phase phase;

    protected ForgeException(String message, String moduleName, Phase phase) {
        super(message);
        this.moduleName = moduleName;
        this.phase = phase;
    }

    protected ForgeException(String message, Throwable cause, String moduleName, Phase phase) {
        super(message, cause);
        this.moduleName = moduleName;
        this.phase = phase;
    }

    /** The module being processed, or {@code null} if not known. */
    public String moduleName() {
        return moduleName;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
