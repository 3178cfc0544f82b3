package io.macroforge.core.engine;

import static org.assertj.core.api.Assertions.assertThat;

import io.macroforge.core.model.Symbol;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link SymbolGenerator}: prefix discipline and uniqueness. */
class SymbolGeneratorTest {

    private final SymbolGenerator generator = new SymbolGenerator(new JavaIdentifierMangler());

    @ParameterizedTest
    @ValueSource(strings = {"", "x", "tmp-value", "+", "a b", "_mf_gensym_", "_mf_gensym__mf_gensym_x", "é", "?!"})
    void everySymbolStartsWithExactlyOnePrefix(String hint) {
        String name = generator.gensym(hint).name();

        assertThat(name).startsWith(SymbolGenerator.PREFIX);
        assertThat(name).doesNotStartWith(SymbolGenerator.PREFIX + SymbolGenerator.PREFIX);
        assertThat(name.substring(SymbolGenerator.PREFIX.length())).doesNotStartWith(SymbolGenerator.PREFIX);
    }

    @Test
    void hintIsEmbeddedInName() {
        assertThat(generator.gensym("counter").name()).isEqualTo("_mf_gensym_counter_1");
        assertThat(generator.gensym("counter").name()).isEqualTo("_mf_gensym_counter_2");
    }

    @Test
    void noHintStillUnique() {
        Symbol a = generator.gensym();
        Symbol b = generator.gensym();

        assertThat(a).isNotEqualTo(b);
    }

    @Test
    void sameHintNeverRepeats() {
        Set<String> names = new HashSet<>();
        for (int i = 0; i < 1_000; i++) {
            names.add(generator.gensym("x").name());
        }
        assertThat(names).hasSize(1_000);
    }

    @Test
    void concurrentCallersGetDistinctSymbols() throws Exception {
        int threads = 8;
        int perThread = 500;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        try {
            List<Callable<List<String>>> tasks = new ArrayList<>();
            for (int t = 0; t < threads; t++) {
                tasks.add(() -> {
                    List<String> names = new ArrayList<>();
                    for (int i = 0; i < perThread; i++) {
                        names.add(generator.gensym("c").name());
                    }
                    return names;
                });
            }
            Set<String> all = new HashSet<>();
            for (Future<List<String>> future : pool.invokeAll(tasks)) {
                all.addAll(future.get());
            }
            assertThat(all).hasSize(threads * perThread);
        } finally {
            pool.shutdown();
            assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void sharedGeneratorIsSingleInstance() {
        assertThat(SymbolGenerator.shared()).isSameAs(SymbolGenerator.shared());
    }
}
