package io.macroforge.core.error;

/** Thrown when a member lookup on an already resolved value misses. */
public final class AttributeNotFoundException extends ForgeException {

    private static final long serialVersionUID = 1L;

    private final String attribute;

    public AttributeNotFoundException(String attribute, Object target) {
        super("'" + target + "' has no attribute '" + attribute + "'", null, Phase.RESOLVE);
        this.attribute = attribute;
    }

    /** The attribute name that was looked up. */
    public String attribute() {
        return attribute;
    }
}
