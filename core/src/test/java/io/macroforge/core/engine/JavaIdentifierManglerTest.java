package io.macroforge.core.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link JavaIdentifierMangler}. */
class JavaIdentifierManglerTest {

    private final JavaIdentifierMangler mangler = new JavaIdentifierMangler();

    @ParameterizedTest
    @CsvSource({
        "foo, foo",
        "foo-bar, foo_bar",
        "_private, _private",
        "__dunder__, __dunder__",
        "a.b-c, a.b_c",
        "+, mfx_Xplus_signX",
        "-, mfx_XhyphenHminusX",
        "valid?, mfx_validXquestion_markX",
        "1st, mfx_1st"
    })
    void mangles(String raw, String expected) {
        assertThat(mangler.mangle(raw)).isEqualTo(expected);
    }

    @ParameterizedTest
    @ValueSource(strings = {"foo-bar", "+", "valid?", "a.b-c", "_x-y", "*"})
    void unmangleReversesMangle(String raw) {
        assertThat(mangler.unmangle(mangler.mangle(raw))).isEqualTo(raw);
    }

    @Test
    void leadingUnderscoresArePreserved() {
        assertThat(mangler.mangle("__+")).startsWith("__mfx_");
    }

    @Test
    void manglingIsIdempotentOnValidIdentifiers() {
        String once = mangler.mangle("with-hyphen");
        assertThat(mangler.mangle(once)).isEqualTo(once);
    }

    @Test
    void emptyIdentifierIsRejected() {
        assertThatThrownBy(() -> mangler.mangle("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void escapePrefixIsExposed() {
        assertThat(mangler.escapePrefix()).isEqualTo(JavaIdentifierMangler.ESCAPE_PREFIX);
    }
}
