package me.golemcore.assistant.tools;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private static final double DELTA = 1e-9;

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "2 + 3 * 4 | 14",
            "(2 + 3) * 4 | 20",
            "10 - 4 - 3 | 3",
            "100 / 4 / 5 | 5",
            "10 % 4 | 2",
            "2 ^ 3 ^ 2 | 512",
            "2 ** 10 | 1024",
            "-3 + 5 | 2",
            "+7 | 7",
            "85 * 0.20 | 17",
            ".5 * 4 | 2",
            "sqrt(16) * 2 | 8",
            "abs(-4.5) | 4.5",
            "floor(2.7) + ceil(2.1) | 5",
            "round(2.5) | 3",
            "log(1000) | 3",
            "log2(8) | 3",
            "min(4, 2, 9) | 2",
            "max(4, 2, 9) | 9",
            "pow(3, 4) | 81",
            "SQRT(9) | 3"
    })
    void shouldEvaluateExpressions(String expression, double expected) {
        assertEquals(expected, ExpressionEvaluator.evaluate(expression), DELTA);
    }

    @Test
    void shouldResolveConstants() {
        assertEquals(Math.PI, ExpressionEvaluator.evaluate("PI"), DELTA);
        assertEquals(Math.E, ExpressionEvaluator.evaluate("e"), DELTA);
        assertEquals(1.0, ExpressionEvaluator.evaluate("ln(e)"), DELTA);
        assertEquals(0.0, ExpressionEvaluator.evaluate("sin(0)"), DELTA);
    }

    @Test
    void shouldReturnInfinityForDivisionByZero() {
        assertTrue(Double.isInfinite(ExpressionEvaluator.evaluate("1 / 0")));
    }

    // ===== Errors =====

    @ParameterizedTest
    @ValueSource(strings = { "", "   " })
    void shouldRejectEmptyExpression(String expression) {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExpressionEvaluator.evaluate(expression));
        assertEquals("Empty expression", e.getMessage());
    }

    @Test
    void shouldRejectDanglingOperator() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExpressionEvaluator.evaluate("85 *"));
        assertEquals("Unexpected end of expression", e.getMessage());
    }

    @Test
    void shouldRejectUnknownIdentifier() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExpressionEvaluator.evaluate("system(1)"));
        assertEquals("Unknown identifier 'system'", e.getMessage());
    }

    @Test
    void shouldRejectTrailingCharacters() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExpressionEvaluator.evaluate("2 + 2 )"));
        assertTrue(e.getMessage().startsWith("Unexpected character ')'"));
    }

    @Test
    void shouldRejectUnbalancedParentheses() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExpressionEvaluator.evaluate("(2 + 2"));
        assertTrue(e.getMessage().startsWith("Expected ')'"));
    }

    @Test
    void shouldRejectWrongArity() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExpressionEvaluator.evaluate("sqrt(1, 2)"));
        assertEquals("sqrt() expects 1 argument(s), got 2", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> ExpressionEvaluator.evaluate("max()"));
    }

    @Test
    void shouldRejectMalformedNumber() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ExpressionEvaluator.evaluate("1.2.3"));
        assertEquals("Invalid number '1.2.3'", e.getMessage());
    }
}
