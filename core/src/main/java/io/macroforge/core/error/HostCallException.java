package io.macroforge.core.error;

/** Thrown when invoking a resolved host function fails or no overload accepts the arguments. */
public final class HostCallException extends ForgeException {

    private static final long serialVersionUID = 1L;

    public HostCallException(String message) {
        super(message, null, Phase.RESOLVE);
    }

    public HostCallException(String message, Throwable cause) {
        super(message, cause, null, Phase.RESOLVE);
    }
}
