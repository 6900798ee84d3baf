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


package me.golemcore.assistant.tools;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.function.DoubleUnaryOperator;

/**
 * Recursive-descent evaluator for arithmetic expressions. No reflection or
 * scripting engine is involved; unknown identifiers are rejected.
 *
 * <pre>
 * expr   -> term (('+' | '-') term)*
 * term   -> power (('*' | '/' | '%') power)*
 * power  -> unary (('^' | '**') power)?
 * unary  -> ('-' | '+') unary | factor
 * factor -> NUMBER | CONSTANT | FUNCTION '(' args ')' | '(' expr ')'
 * </pre>
 */
final class ExpressionEvaluator {

    private static final Map<String, DoubleUnaryOperator> UNARY_FUNCTIONS = Map.ofEntries(
            Map.entry("sqrt", Math::sqrt),
            Map.entry("sin", Math::sin),
            Map.entry("cos", Math::cos),
            Map.entry("tan", Math::tan),
            Map.entry("log", Math::log10),
            Map.entry("log10", Math::log10),
            Map.entry("log2", value -> Math.log(value) / Math.log(2)),
            Map.entry("ln", Math::log),
            Map.entry("abs", Math::abs),
            Map.entry("floor", Math::floor),
            Map.entry("ceil", Math::ceil),
            Map.entry("round", value -> (double) Math.round(value)),
            Map.entry("exp", Math::exp));

    private static final List<String> VARIADIC_FUNCTIONS = List.of("min", "max", "pow");

    private static final Map<String, Double> CONSTANTS = Map.of("pi", Math.PI, "e", Math.E);

    private final String expression;
    private int pos;

    private ExpressionEvaluator(String expression) {
        this.expression = expression;
    }

    /**
     * Evaluates the expression.
     *
     * @throws IllegalArgumentException
     *             on a syntax error, an unknown identifier or an empty
     *             expression
     */
    static double evaluate(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new IllegalArgumentException("Empty expression");
        }
        ExpressionEvaluator evaluator = new ExpressionEvaluator(expression);
        double result = evaluator.parseExpression();
        evaluator.skipWhitespace();
        if (evaluator.pos < expression.length()) {
            throw new IllegalArgumentException("Unexpected character '" + expression.charAt(evaluator.pos)
                    + "' at position " + evaluator.pos);
        }
        return result;
    }

    private double parseExpression() {
        double left = parseTerm();
        while (true) {
            if (eat('+')) {
                left += parseTerm();
            } else if (eat('-')) {
                left -= parseTerm();
            } else {
                return left;
            }
        }
    }

    private double parseTerm() {
        double left = parsePower();
        while (true) {
            if (eat('*')) {
                left *= parsePower();
            } else if (eat('/')) {
                left /= parsePower();
            } else if (eat('%')) {
                left %= parsePower();
            } else {
                return left;
            }
        }
    }

    // Right-associative: 2^3^2 = 2^9
    private double parsePower() {
        double base = parseUnary();
        if (eat('^')) {
            return Math.pow(base, parsePower());
        }
        if (peekDoubleStar()) {
            pos += 2;
            return Math.pow(base, parsePower());
        }
        return base;
    }

    private double parseUnary() {
        if (eat('-')) {
            return -parseUnary();
        }
        if (eat('+')) {
            return parseUnary();
        }
        return parseFactor();
    }

    private double parseFactor() {
        skipWhitespace();
        if (pos >= expression.length()) {
            throw new IllegalArgumentException("Unexpected end of expression");
        }
        char current = expression.charAt(pos);

        if (eat('(')) {
            double value = parseExpression();
            expect(')');
            return value;
        }
        if (Character.isDigit(current) || current == '.') {
            return parseNumber();
        }
        if (Character.isLetter(current)) {
            return parseIdentifier();
        }
        throw new IllegalArgumentException("Unexpected character '" + current + "' at position " + pos);
    }

    private double parseNumber() {
        int start = pos;
        while (pos < expression.length()
                && (Character.isDigit(expression.charAt(pos)) || expression.charAt(pos) == '.')) {
            pos++;
        }
        String number = expression.substring(start, pos);
        try {
            return Double.parseDouble(number);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number '" + number + "'", e);
        }
    }

    private double parseIdentifier() {
        int start = pos;
        while (pos < expression.length() && Character.isLetterOrDigit(expression.charAt(pos))) {
            pos++;
        }
        String name = expression.substring(start, pos).toLowerCase(Locale.ROOT);

        Double constant = CONSTANTS.get(name);
        if (constant != null) {
            return constant;
        }
        DoubleUnaryOperator function = UNARY_FUNCTIONS.get(name);
        if (function != null) {
            List<Double> args = parseArguments();
            requireArity(name, args, 1);
            return function.applyAsDouble(args.get(0));
        }
        if (VARIADIC_FUNCTIONS.contains(name)) {
            List<Double> args = parseArguments();
            return switch (name) {
            case "pow" -> {
                requireArity(name, args, 2);
                yield Math.pow(args.get(0), args.get(1));
            }
            case "min" -> args.stream().mapToDouble(Double::doubleValue).min()
                    .orElseThrow(() -> new IllegalArgumentException("min() needs at least one argument"));
            default -> args.stream().mapToDouble(Double::doubleValue).max()
                    .orElseThrow(() -> new IllegalArgumentException("max() needs at least one argument"));
            };
        }
        throw new IllegalArgumentException("Unknown identifier '" + name + "'");
    }

    private List<Double> parseArguments() {
        expect('(');
        List<Double> args = new ArrayList<>();
        if (eat(')')) {
            return args;
        }
        do {
            args.add(parseExpression());
        } while (eat(','));
        expect(')');
        return args;
    }

    private static void requireArity(String name, List<Double> args, int arity) {
        if (args.size() != arity) {
            throw new IllegalArgumentException(name + "() expects " + arity + " argument(s), got " + args.size());
        }
    }

    private boolean peekDoubleStar() {
        skipWhitespace();
        return expression.startsWith("**", pos);
    }

    private boolean eat(char expected) {
        skipWhitespace();
        if (pos < expression.length() && expression.charAt(pos) == expected) {
            pos++;
            return true;
        }
        return false;
    }

    private void expect(char expected) {
        if (!eat(expected)) {
            throw new IllegalArgumentException("Expected '" + expected + "' at position " + pos);
        }
    }

    private void skipWhitespace() {
        while (pos < expression.length() && Character.isWhitespace(expression.charAt(pos))) {
            pos++;
        }
    }
}
