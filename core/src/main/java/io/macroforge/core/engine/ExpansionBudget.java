package io.macroforge.core.engine;

/**
 * Optional ceiling on the number of expansion steps a single {@code macroexpand} call may take.
 * Unbounded by default: a macro that always expands into another macro call loops forever, and
 * guarding against that is the macro author's job. A positive ceiling turns such loops into an
 * {@link io.macroforge.core.error.ExpansionBudgetExceededException}.
 *
 * <p>Immutable and thread-safe.
 *
 * @param maxSteps maximum expansion steps per call, or {@code 0} for no limit
 */
public record ExpansionBudget(int maxSteps) {

    /** No ceiling. */
    public static final ExpansionBudget UNBOUNDED = new ExpansionBudget(0);

    public ExpansionBudget {
        if (maxSteps < 0) {
            throw new IllegalArgumentException("maxSteps must not be negative, got: " + maxSteps);
        }
    }

    /** True when a ceiling is in force. */
    public boolean isBounded() {
        return maxSteps > 0;
    }
}
