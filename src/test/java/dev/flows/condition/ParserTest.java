package dev.flows.condition;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParserTest {

    @Test
    void questionDotBeforeDigitIsTernary() {
        assertThat(eval("true ?.5 : 1")).isEqualTo(0.5);
    }

    @Test
    void stringEscapesAreDecoded() {
        assertThat(eval("'it\\'s\\n'")).isEqualTo("it's\n");
        assertThat(eval("\"a\" + 'b'")).isEqualTo("ab");
    }

    @Test
    void parenthesizedLambdaParameter() {
        assertThat(eval("[1, 2].every((n) => n > 0)")).isEqualTo(true);
    }

    @Test
    void logicalOperatorsYieldOperands() {
        assertThat(eval("0 || 'x'")).isEqualTo("x");
        assertThat(eval("'' && 'x'")).isEqualTo("");
    }

    @Test
    void syntaxErrorsCarryPosition() {
        assertThatThrownBy(() -> Parser.parse("a & b"))
            .isInstanceOfSatisfying(ConditionSyntaxException.class, e -> {
                assertThat(e.position()).isEqualTo(2);
                assertThat(e.getMessage()).isEqualTo("Unexpected character '&' at position 2");
            });
        assertThatThrownBy(() -> Parser.parse("'open"))
            .isInstanceOf(ConditionSyntaxException.class)
            .hasMessageStartingWith("Unterminated string");
        assertThatThrownBy(() -> Parser.parse("(a"))
            .hasMessageStartingWith("Expected ')'");
    }

    private static Object eval(String source) {
        return Parser.parse(source).evaluate(new Scope(Map.of()));
    }
}
