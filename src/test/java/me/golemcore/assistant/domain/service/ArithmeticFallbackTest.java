package me.golemcore.assistant.domain.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ArithmeticFallbackTest {

    @Test
    void shouldEvaluatePercentOf() {
        assertEquals(Optional.of("20% of 85 = 17"), ArithmeticFallback.evaluate("What's 20% of 85?"));
        assertEquals(Optional.of("15% of 42.5 = 6.375"),
                ArithmeticFallback.evaluate("what is 15 percent of 42.50"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "what is 9 x 8|9 × 8 = 72",
            "9 * 8|9 × 8 = 72",
            "12 + 30|12 + 30 = 42",
            "5-3|5 - 3 = 2",
            "10 / 4|10 ÷ 4 = 2.5",
            "10 ÷ 3|10 ÷ 3 = 3.3333333333",
            "1,000 + 250|1000 + 250 = 1250"
    })
    void shouldEvaluateSingleBinaryOperation(String text, String expected) {
        assertEquals(Optional.of(expected), ArithmeticFallback.evaluate(text));
    }

    @Test
    void shouldReportDivisionByZero() {
        assertEquals(Optional.of("9 ÷ 0 is undefined (division by zero)"),
                ArithmeticFallback.evaluate("what's 9 / 0"));
    }

    @Test
    void shouldReturnEmptyWithoutExpression() {
        assertTrue(ArithmeticFallback.evaluate("hello there").isEmpty());
        assertTrue(ArithmeticFallback.evaluate("").isEmpty());
        assertTrue(ArithmeticFallback.evaluate(null).isEmpty());
    }

    @Test
    void shouldFormatWithoutTrailingZeros() {
        assertEquals("17", ArithmeticFallback.format(new BigDecimal("17.000")));
        assertEquals("0", ArithmeticFallback.format(new BigDecimal("0.00")));
        assertEquals("1200", ArithmeticFallback.format(new BigDecimal("1.2E+3")));
    }
}
