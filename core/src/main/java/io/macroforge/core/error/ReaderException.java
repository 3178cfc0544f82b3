package io.macroforge.core.error;

/** Thrown for malformed source text, or when a reader macro fails. */
public final class ReaderException extends ForgeException {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public ReaderException(String message, int offset) {
        super(message + " (at offset " + offset + ")", null, Phase.READ);
        this.offset = offset;
    }

    public ReaderException(String message, int offset, Throwable cause) {
        super(message + " (at offset " + offset + ")", cause, null, Phase.READ);
        this.offset = offset;
    }

    /** Character offset in the source at which the problem was detected. */
    public int offset() {
        return offset;
    }
}
