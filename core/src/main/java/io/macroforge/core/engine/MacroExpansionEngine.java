package io.macroforge.core.engine;

import io.macroforge.core.error.ExpansionBudgetExceededException;
import io.macroforge.core.error.ForgeException;
import io.macroforge.core.error.MacroExpansionException;
import io.macroforge.core.model.MacroBinding;
import io.macroforge.core.model.MacroResult;
import io.macroforge.core.model.Node;
import io.macroforge.core.model.Sequence;
import io.macroforge.core.model.Symbol;
import io.macroforge.core.model.Verbatim;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rewrites macro calls.
 *
 * <p>A form is a macro call when it is call-shaped (see {@link Sequence#isCallShaped()}) and the
 * mangled name of its head is bound in the context's macro table. Anything else passes through
 * unchanged, which makes every operation here safe to apply uniformly while walking a tree.
 *
 * <p>{@link #macroexpand} repeats expansion until the head no longer names a macro. There is no
 * built-in depth guard: a macro that always yields another macro call loops forever unless an
 * {@link ExpansionBudget} is configured.
 *
 * <p>Stateless apart from the budget; thread-safe.
 */
public final class MacroExpansionEngine {

    private static final Logger LOG = LoggerFactory.getLogger(MacroExpansionEngine.class);

    private static final String QUOTE = "quote";

    private final ExpansionBudget budget;

    public MacroExpansionEngine() {
        this(ExpansionBudget.UNBOUNDED);
    }

    public MacroExpansionEngine(ExpansionBudget budget) {
        this.budget = Objects.requireNonNull(budget, "budget must not be null");
    }

    public ExpansionBudget budget() {
        return budget;
    }

    /** Expands {@code form} to fixpoint, treating verbatim results as unexpandable. */
    public Node macroexpand(Node form, ExpansionContext context) {
        return macroexpand(form, context, false);
    }

    /**
     * Expands {@code form} until its head no longer names a macro.
     *
     * @param form     any node
     * @param context  the module context to resolve macros in
     * @param resultOk when {@code true}, a {@link Verbatim} result ends expansion and its node is
     *                 returned; when {@code false}, the form that produced it is returned instead
     * @return the expanded node, or {@code form} itself if it is not a macro call
     * @throws MacroExpansionException if an expander fails
     */
    public Node macroexpand(Node form, ExpansionContext context, boolean resultOk) {
        return expand(form, context, false, resultOk).node();
    }

    /**
     * Performs at most one expansion step.
     *
     * @return the expanded node, or {@code form} itself if its head is not a macro
     * @throws MacroExpansionException if the expander fails
     */
    public Node macroexpand1(Node form, ExpansionContext context) {
        return expand(form, context, true, true).node();
    }

    /**
     * Expands {@code form} to fixpoint and then every sub-form of the result, depth first.
     * Quoted forms and the nodes of verbatim results are left alone.
     */
    public Node expandAll(Node form, ExpansionContext context) {
        Expansion expansion = expand(form, context, false, true);
        Node expanded = expansion.node();
        if (expansion.verbatim() || !(expanded instanceof Sequence seq) || seq.isEmpty() || isQuote(seq)) {
            return expanded;
        }
        List<Node> children = new ArrayList<>(seq.size());
        boolean changed = false;
        for (Node child : seq.items()) {
            Node result = expandAll(child, context);
            changed |= result != child;
            children.add(result);
        }
        return changed ? new Sequence(seq.delimiter(), children) : seq;
    }

    private Expansion expand(Node form, ExpansionContext context, boolean once, boolean resultOk) {
        Objects.requireNonNull(form, "form must not be null");
        Objects.requireNonNull(context, "context must not be null");

        Node current = form;
        int steps = 0;
        while (current instanceof Sequence call && call.isCallShaped()) {
            String name = context.mangler().mangle(((Symbol) call.get(0)).name());
            Optional<MacroBinding> binding = context.macros().lookup(name);
            if (binding.isEmpty()) {
                break;
            }
            if (budget.isBounded() && steps >= budget.maxSteps()) {
                throw new ExpansionBudgetExceededException(
                        "Macro expansion exceeded " + budget.maxSteps() + " steps at " + name,
                        call,
                        context.moduleName(),
                        budget.maxSteps());
            }

            MacroResult result = invoke(binding.get(), call, context);
            steps++;
            LOG.debug(
                    "macro.expanded name={} module={} origin={} step={}",
                    name,
                    context.moduleName(),
                    binding.get().originModule(),
                    steps);

            if (result instanceof Verbatim verbatim) {
                return resultOk ? new Expansion(verbatim.value(), true) : new Expansion(current, false);
            }
            current = (Node) result;
            if (once) {
                break;
            }
        }
        return new Expansion(current, false);
    }

    /** Runs the expander in its originating module's context and normalizes failures. */
    private static MacroResult invoke(MacroBinding binding, Sequence call, ExpansionContext context) {
        ExpansionContext origin = context.forModule(binding.originModule());
        MacroResult result;
        try {
            result = binding.expander().expand(origin, call.tail());
        } catch (ForgeException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new MacroExpansionException(
                    "expanding macro " + call.get(0) + "\n  " + e.getClass().getSimpleName() + ": " + e.getMessage(),
                    e,
                    call,
                    context.moduleName());
        }
        if (result == null) {
            throw new MacroExpansionException(
                    "expanding macro " + call.get(0) + "\n  expander returned null", call, context.moduleName());
        }
        return result;
    }

    /** Result of one {@link #expand} run; {@code verbatim} marks a node that must not be walked. */
    private record Expansion(Node node, boolean verbatim) {}

    private static boolean isQuote(Sequence seq) {
        return seq.isCallShaped() && QUOTE.equals(((Symbol) seq.get(0)).name());
    }
}
