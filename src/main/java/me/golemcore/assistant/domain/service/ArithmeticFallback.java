/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */


package me.golemcore.assistant.domain.service;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Evaluates the first simple arithmetic expression found in free text, for
 * when the model or the calculator tool cannot be trusted or is not available.
 * Supports one binary operator ({@code + - * / × ÷ x}) and "N% of M".
 */
public final class ArithmeticFallback {

    private static final String NUMBER = "(-?\\d+(?:\\.\\d+)?)";
    private static final Pattern PERCENT_OF = Pattern.compile(
            NUMBER + "\\s*(?:%|percent)\\s+of\\s+" + NUMBER, Pattern.CASE_INSENSITIVE);
    private static final Pattern BINARY = Pattern.compile(
            NUMBER + "\\s*([+\\-*/×÷xX])\\s*" + NUMBER);
    private static final Pattern THOUSANDS_SEPARATOR = Pattern.compile("(?<=\\d),(?=\\d{3}\\b)");
    private static final int MAX_SCALE = 10;

    private ArithmeticFallback() {
    }

    /**
     * @return a sentence ending in {@code "= <result>"}, an "undefined" notice
     *         for division by zero, or empty when no expression was found
     */
    public static Optional<String> evaluate(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        String normalized = THOUSANDS_SEPARATOR.matcher(text).replaceAll("");

        Matcher percent = PERCENT_OF.matcher(normalized);
        if (percent.find()) {
            BigDecimal rate = new BigDecimal(percent.group(1));
            BigDecimal base = new BigDecimal(percent.group(2));
            BigDecimal result = rate.multiply(base).divide(BigDecimal.valueOf(100), MathContext.DECIMAL64);
            return Optional.of(format(rate) + "% of " + format(base) + " = " + format(result));
        }

        Matcher binary = BINARY.matcher(normalized);
        if (!binary.find()) {
            return Optional.empty();
        }
        BigDecimal left = new BigDecimal(binary.group(1));
        BigDecimal right = new BigDecimal(binary.group(3));
        String operator = binary.group(2);
        String symbol;
        BigDecimal result;
        switch (operator) {
        case "+":
            symbol = "+";
            result = left.add(right);
            break;
        case "-":
            symbol = "-";
            result = left.subtract(right);
            break;
        case "/":
        case "÷":
            symbol = "÷";
            if (right.signum() == 0) {
                return Optional.of(format(left) + " ÷ 0 is undefined (division by zero)");
            }
            result = left.divide(right, MathContext.DECIMAL64);
            break;
        default:
            symbol = "×";
            result = left.multiply(right);
            break;
        }
        return Optional.of(format(left) + " " + symbol + " " + format(right) + " = " + format(result));
    }

    static String format(BigDecimal value) {
        BigDecimal scaled = value.scale() > MAX_SCALE ? value.setScale(MAX_SCALE, RoundingMode.HALF_UP) : value;
        BigDecimal stripped = scaled.stripTrailingZeros();
        if (stripped.signum() == 0) {
            return "0";
        }
        return stripped.toPlainString();
    }
}
