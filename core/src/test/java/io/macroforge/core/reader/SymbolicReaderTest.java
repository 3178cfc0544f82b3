package io.macroforge.core.reader;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.macroforge.core.error.EndOfInputException;
import io.macroforge.core.error.ReaderException;
import io.macroforge.core.model.Literal;
import io.macroforge.core.model.Node;
import io.macroforge.core.model.Sequence;
import io.macroforge.core.model.Symbol;
import io.macroforge.core.spi.ReaderMacro;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/** Tests for {@link SymbolicReader}. */
class SymbolicReaderTest {

    private static Node readOne(String source) {
        return SymbolicReader.of(source).read();
    }

    @Test
    void readsFormsOneAtATimeThenSignalsEnd() {
        SymbolicReader reader = SymbolicReader.of("(+ 2 2)\n(- 2 2)");

        assertThat(reader.read()).isEqualTo(Sequence.call(Symbol.of("+"), Literal.of(2L), Literal.of(2L)));
        assertThat(reader.read()).isEqualTo(Sequence.call(Symbol.of("-"), Literal.of(2L), Literal.of(2L)));
        assertThatThrownBy(reader::read).isInstanceOf(EndOfInputException.class);
    }

    @Test
    void readAllStopsAtEnd() {
        List<Node> forms = SymbolicReader.of("a ; comment\n[b] \"c\"").readAll();

        assertThat(forms).containsExactly(Symbol.of("a"), Sequence.list(Symbol.of("b")), Literal.of("c"));
    }

    @Test
    void emptyInputHasNoForms() {
        assertThat(SymbolicReader.of("  ; only a comment").readAll()).isEmpty();
        assertThatThrownBy(() -> readOne("")).isInstanceOf(EndOfInputException.class);
    }

    @Nested
    @DisplayName("atoms")
    class Atoms {

        @Test
        void integersAreLong() {
            assertThat(readOne("42")).isEqualTo(Literal.of(42L));
            assertThat(readOne("-7")).isEqualTo(Literal.of(-7L));
        }

        @Test
        void floatsAreDouble() {
            assertThat(readOne("2.5")).isEqualTo(Literal.of(2.5));
            assertThat(readOne("1e3")).isEqualTo(Literal.of(1000.0));
        }

        @Test
        void booleans() {
            assertThat(readOne("true")).isEqualTo(Literal.of(true));
            assertThat(readOne("false")).isEqualTo(Literal.of(false));
        }

        @ParameterizedTest
        @ValueSource(strings = {"+", "-", "foo-bar", "a.b.c", "valid?", "->", "_x"})
        void symbols(String text) {
            assertThat(readOne(text)).isEqualTo(Symbol.of(text));
        }

        @Test
        void stringEscapes() {
            assertThat(readOne("\"a\\\"b\\\\c\\nd\\te\"")).isEqualTo(Literal.of("a\"b\\c\nd\te"));
        }

        @Test
        void emptyStringZeroAndEmptyListStayDistinct() {
            List<Node> forms = SymbolicReader.of("\"\" 0 []").readAll();

            assertThat(forms).containsExactly(Literal.of(""), Literal.of(0L), Sequence.list());
            assertThat(forms).doesNotHaveDuplicates();
        }
    }

    @Nested
    @DisplayName("sequences")
    class Sequences {

        @Test
        void nestedDelimiters() {
            assertThat(readOne("(f [1 (g)] x)"))
                    .isEqualTo(Sequence.call(
                            Symbol.of("f"),
                            Sequence.list(Literal.of(1L), Sequence.call(Symbol.of("g"))),
                            Symbol.of("x")));
        }

        @Test
        void quoteShorthand() {
            assertThat(readOne("'(a b)"))
                    .isEqualTo(Sequence.call(Symbol.of("quote"), Sequence.call(Symbol.of("a"), Symbol.of("b"))));
        }

        @Test
        void commasAreWhitespace() {
            assertThat(readOne("[1, 2]")).isEqualTo(Sequence.list(Literal.of(1L), Literal.of(2L)));
        }

        @Test
        void whitespaceDoesNotAffectTree() {
            assertThat(readOne("(  +\n\t2   2 )")).isEqualTo(readOne("(+ 2 2)"));
        }
    }

    @Nested
    @DisplayName("errors")
    class Errors {

        @ParameterizedTest
        @ValueSource(strings = {"(a b", "[1 (2)", "\"open", "'", "(f \"x\\"})
        void truncatedInputIsEndOfInput(String source) {
            assertThatThrownBy(() -> readOne(source)).isInstanceOf(EndOfInputException.class);
        }

        @Test
        void strayCloserIsReaderError() {
            assertThatThrownBy(() -> readOne(")"))
                    .isInstanceOf(ReaderException.class)
                    .satisfies(e -> assertThat(((ReaderException) e).offset()).isZero());
        }

        @Test
        void mismatchedCloserIsReaderError() {
            assertThatThrownBy(() -> readOne("(a ]"))
                    .isInstanceOf(ReaderException.class)
                    .hasMessageContaining("Mismatched");
        }

        @Test
        void unknownEscapeIsReaderError() {
            assertThatThrownBy(() -> readOne("\"\\q\"")).isInstanceOf(ReaderException.class);
        }

        @Test
        void truncatedFormInReadAllStillRaises() {
            SymbolicReader reader = SymbolicReader.of("(ok) (broken");

            assertThatThrownBy(reader::readAll).isInstanceOf(EndOfInputException.class);
        }
    }

    @Nested
    @DisplayName("reader macros")
    class ReaderMacros {

        private final ReaderMacro upper = reader -> {
            Node next = reader.read();
            return Literal.of(((String) ((Literal) next).value()).toUpperCase());
        };

        @Test
        void tagDispatchesToEnabledMacro() {
            SymbolicReader reader = SymbolicReader.of("(greet #upper \"hi\" x)");
            reader.enable("upper", upper);

            assertThat(reader.read())
                    .isEqualTo(Sequence.call(Symbol.of("greet"), Literal.of("HI"), Symbol.of("x")));
        }

        @Test
        void macroMayReadNothing() {
            SymbolicReader reader = SymbolicReader.of("[#now 1]");
            reader.enable("now", r -> Literal.of(42L));

            assertThat(reader.read()).isEqualTo(Sequence.list(Literal.of(42L), Literal.of(1L)));
        }

        @Test
        void unknownTagIsReaderError() {
            assertThatThrownBy(() -> readOne("#upper \"hi\""))
                    .isInstanceOf(ReaderException.class)
                    .hasMessageContaining("#upper");
        }

        @Test
        void bareHashIsReaderError() {
            assertThatThrownBy(() -> readOne("# x"))
                    .isInstanceOf(ReaderException.class)
                    .hasMessageContaining("Missing reader macro name");
        }

        @Test
        void failingMacroIsWrapped() {
            SymbolicReader reader = SymbolicReader.of("#upper 5");
            reader.enable("upper", upper);

            assertThatThrownBy(reader::read)
                    .isInstanceOf(ReaderException.class)
                    .hasMessageContaining("Reader macro #upper failed")
                    .hasCauseInstanceOf(ClassCastException.class);
        }

        @Test
        void macroHittingEndOfInputSignalsEnd() {
            SymbolicReader reader = SymbolicReader.of("#upper");
            reader.enable("upper", upper);

            assertThatThrownBy(reader::read).isInstanceOf(EndOfInputException.class);
        }

        @Test
        void nullResultIsReaderError() {
            SymbolicReader reader = SymbolicReader.of("#nothing");
            reader.enable("nothing", r -> null);

            assertThatThrownBy(reader::read)
                    .isInstanceOf(ReaderException.class)
                    .hasMessageContaining("returned null");
        }
    }
}
