package io.macroforge.core.engine;

import static io.macroforge.core.testkit.TestMacros.read;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.macroforge.core.engine.MacroPattern.Shape;
import io.macroforge.core.error.MacroExpansionException;
import io.macroforge.core.model.Literal;
import io.macroforge.core.model.Node;
import io.macroforge.core.model.Sequence;
import io.macroforge.core.spi.MacroExpander;
import io.macroforge.core.testkit.InMemoryModuleProvider;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/** Tests for {@link MacroPattern}. */
class MacroPatternTest {

    private static final MacroPattern DEFN = MacroPattern.of("defn", Shape.SYMBOL, Shape.BRACKET)
            .optional(Shape.STRING)
            .rest(Shape.ANY);

    private static List<Node> args(String call) {
        return ((Sequence) read(call)).tail();
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "(defn f [])",
                "(defn f [x] \"doc\")",
                "(defn f [x] \"doc\" (g x) (h x))"
            })
    void matchingCallsPass(String call) {
        assertThatCode(() -> DEFN.check(args(call), "app")).doesNotThrowAnyException();
    }

    @ParameterizedTest
    @CsvSource(
            delimiter = '|',
            value = {
                "(defn)                | expected 2 more argument(s), got end of macro call",
                "(defn f)              | expected 1 more argument(s), got end of macro call",
                "(defn \"f\" [])       | argument 1 must be a symbol, got \"f\"",
                "(defn f (x))          | argument 2 must be a bracketed sequence, got (x)",
                "(defn f [x] 42 (g))   | argument 3 must be a string, got 42"
            })
    void mismatchesAreReportedByPosition(String call, String detail) {
        assertThatThrownBy(() -> DEFN.check(args(call), "app"))
                .isInstanceOf(MacroExpansionException.class)
                .hasMessage("parse error for pattern macro 'defn': " + detail);
    }

    @Test
    void surplusArgumentsFailWithoutRestShape() {
        MacroPattern pair = MacroPattern.of("pair", Shape.ANY, Shape.ANY);

        assertThatThrownBy(() -> pair.check(args("(pair a b c)"), "app"))
                .isInstanceOf(MacroExpansionException.class)
                .hasMessageEndingWith("unexpected argument 3: c");
    }

    @Test
    void failureCarriesRebuiltCallAndModule() {
        assertThatThrownBy(() -> DEFN.check(args("(defn 1 [])"), "app"))
                .isInstanceOf(MacroExpansionException.class)
                .satisfies(e -> {
                    MacroExpansionException ex = (MacroExpansionException) e;
                    assertThat(ex.form()).isEqualTo(read("(defn 1 [])"));
                    assertThat(ex.moduleName()).isEqualTo("app");
                });
    }

    @Test
    void wrappedExpanderOnlyRunsOnMatch() {
        JavaIdentifierMangler mangler = new JavaIdentifierMangler();
        MacroEnvironment environment = new MacroEnvironment(mangler);
        ExpansionContext context = new ExpansionContext(
                "app", environment, new SymbolGenerator(mangler), new QualifiedResolver(new InMemoryModuleProvider(), mangler));
        AtomicInteger calls = new AtomicInteger();
        MacroExpander expander = MacroPattern.of("one", Shape.LITERAL).wrap((ctx, a) -> {
            calls.incrementAndGet();
            return a.get(0);
        });

        assertThat(expander.expand(context, List.of(Literal.of(1L)))).isEqualTo(Literal.of(1L));
        assertThatThrownBy(() -> expander.expand(context, List.of()))
                .isInstanceOf(MacroExpansionException.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    void optionalAfterRestIsRejected() {
        assertThatThrownBy(() -> MacroPattern.of("m").rest(Shape.ANY).optional(Shape.ANY))
                .isInstanceOf(IllegalStateException.class);
    }
}
