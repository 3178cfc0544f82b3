package io.macroforge.core.error;

/**
 * Thrown when the reader runs out of input before a complete form is available. Recoverable: a
 * read loop treats it as its stop signal.
 */
public final class EndOfInputException extends ForgeException {

    private static final long serialVersionUID = 1L;

    public EndOfInputException(String message) {
        super(message, null, Phase.READ);
    }
}
