package io.macroforge.core.error;

import io.macroforge.core.model.Node;

/**
 * Thrown when a macro expander fails. Carries the form whose expansion failed; the original error
 * is the cause. Fatal to the enclosing compile unless the caller catches it.
 */
public class MacroExpansionException extends ForgeException {

    private static final long serialVersionUID = 1L;

    private final transient Node form;

    public MacroExpansionException(String message, Node form, String moduleName) {
        super(message, moduleName, Phase.EXPAND);
        this.form = form;
    }

    public MacroExpansionException(String message, Throwable cause, Node form, String moduleName) {
        super(message, cause, moduleName, Phase.EXPAND);
        this.form = form;
    }

    /** The macro call being expanded when the error occurred. */
    public Node form() {
        return form;
    }
}
