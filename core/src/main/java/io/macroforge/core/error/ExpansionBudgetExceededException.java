package io.macroforge.core.error;

import io.macroforge.core.model.Node;

/** Thrown when an opt-in expansion step ceiling is exceeded. */
public final class ExpansionBudgetExceededException extends MacroExpansionException {

    private static final long serialVersionUID = 1L;

    private final int maxSteps;

    public ExpansionBudgetExceededException(String message, Node form, String moduleName, int maxSteps) {
        super(message, form, moduleName);
        this.maxSteps = maxSteps;
    }

    /** The configured ceiling that was exceeded. */
    public int maxSteps() {
        return maxSteps;
    }
}
