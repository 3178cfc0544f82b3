package io.macroforge.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the symbolic tree node types. */
class NodeTest {

    @Nested
    @DisplayName("Literal")
    class LiteralTests {

        @Test
        void emptyStringZeroAndEmptyListAreDistinct() {
            Node emptyString = Literal.of("");
            Node zero = Literal.of(0L);
            Node emptyList = Sequence.list();

            assertThat(emptyString).isNotEqualTo(zero);
            assertThat(emptyString).isNotEqualTo(emptyList);
            assertThat(zero).isNotEqualTo(emptyList);
            assertThat(Literal.of(0L)).isNotEqualTo(Literal.of(0.0));
        }

        @Test
        void integerIsWidenedToLong() {
            assertThat(new Literal(5).value()).isEqualTo(5L);
            assertThat(new Literal(5)).isEqualTo(Literal.of(5L));
        }

        @Test
        void unsupportedTypeIsRejected() {
            assertThatThrownBy(() -> new Literal(new Object()))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unsupported literal type");
        }

        @Test
        void stringRendersQuotedAndEscaped() {
            assertThat(Literal.of("a\"b\\c\n").render()).isEqualTo("\"a\\\"b\\\\c\\n\"");
        }
    }

    @Nested
    @DisplayName("Sequence")
    class SequenceTests {

        @Test
        void parenAndBracketWithSameItemsDiffer() {
            assertThat(Sequence.call(Symbol.of("a"))).isNotEqualTo(Sequence.list(Symbol.of("a")));
        }

        @Test
        void callShapeRequiresParenAndSymbolHead() {
            assertThat(Sequence.call(Symbol.of("f"), Literal.of(1L)).isCallShaped()).isTrue();
            assertThat(Sequence.list(Symbol.of("f")).isCallShaped()).isFalse();
            assertThat(Sequence.call().isCallShaped()).isFalse();
            assertThat(Sequence.call(Literal.of(1L), Symbol.of("f")).isCallShaped()).isFalse();
        }

        @Test
        void itemsAreCopiedAndImmutable() {
            List<Node> items = new ArrayList<>(List.of(Symbol.of("a")));
            Sequence seq = Sequence.call(items);
            items.add(Symbol.of("b"));

            assertThat(seq.size()).isEqualTo(1);
            assertThatThrownBy(() -> seq.items().add(Symbol.of("c")))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void tailOfEmptySequenceIsEmpty() {
            assertThat(Sequence.call().tail()).isEmpty();
            assertThat(Sequence.call(Symbol.of("f"), Literal.of(1L)).tail()).containsExactly(Literal.of(1L));
        }

        @Test
        void renderNestsDelimiters() {
            Sequence seq = Sequence.call(Symbol.of("f"), Sequence.list(Literal.of(1L), Literal.of("x")));

            assertThat(seq.render()).isEqualTo("(f [1 \"x\"])");
        }
    }

    @Test
    void emptySymbolIsRejected() {
        assertThatThrownBy(() -> Symbol.of("")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void visitorDispatchesOnKind() {
        NodeVisitor<String> kinds = new NodeVisitor<>() {
            @Override
            public String visitSymbol(Symbol symbol) {
                return "symbol";
            }

            @Override
            public String visitSequence(Sequence sequence) {
                return "sequence";
            }

            @Override
            public String visitLiteral(Literal literal) {
                return "literal";
            }
        };

        assertThat(Symbol.of("x").accept(kinds)).isEqualTo("symbol");
        assertThat(Sequence.list().accept(kinds)).isEqualTo("sequence");
        assertThat(Literal.of(true).accept(kinds)).isEqualTo("literal");
    }
}
