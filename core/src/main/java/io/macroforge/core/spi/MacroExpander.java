package io.macroforge.core.spi;

import io.macroforge.core.engine.ExpansionContext;
import io.macroforge.core.model.MacroResult;
import io.macroforge.core.model.Node;
import java.util.List;

/**
 * A compile-time function rewriting a macro call into another node.
 *
 * <p>The expander receives the call's argument nodes unevaluated, together with the context of the
 * module that defined the macro. Any exception it throws is reported to the caller of the
 * expansion as a {@link io.macroforge.core.error.MacroExpansionException} carrying the call form.
 */
@FunctionalInterface
public interface MacroExpander {

    /**
     * Expands one macro call.
     *
     * @param context the originating module's expansion context
     * @param args    the call's argument nodes, head excluded
     * @return the replacement node, or a {@link io.macroforge.core.model.Verbatim} marker
     */
    MacroResult expand(ExpansionContext context, List<Node> args);
}
