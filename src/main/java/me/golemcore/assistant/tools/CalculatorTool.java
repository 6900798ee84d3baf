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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import me.golemcore.assistant.domain.model.ToolPriority;
import me.golemcore.assistant.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Evaluates arithmetic expressions: + - * / % and ^, parentheses, common
 * functions (sqrt, sin, cos, tan, log, ln, abs, floor, ceil, round, exp, min,
 * max, pow) and the constants PI and E.
 */
@Component
@Slf4j
public class CalculatorTool implements ToolComponent {

    public static final String TOOL_NAME = "calculator";

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Evaluate a math expression. Use for arithmetic, percentages, tips and conversions. "
                        + "Supports + - * / % ^, parentheses, sqrt, sin, cos, tan, log, ln, abs, floor, ceil, "
                        + "round, exp, min, max, pow, PI and E.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "expression", Map.of(
                                        "type", "string",
                                        "description", "Expression to evaluate, e.g. '85 * 0.20' or 'sqrt(16) * 2'")),
                        "required", List.of("expression")))
                .build();
    }

    @Override
    public ToolPriority getPriority() {
        return ToolPriority.CORE;
    }

    @Override
    public String getCapability() {
        return "do math calculations";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object expression = parameters.get("expression");
        if (!(expression instanceof String text) || text.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure(
                    ToolExecutionException.Kind.INVALID_ARGUMENTS, "Missing required parameter: expression"));
        }
        return CompletableFuture.completedFuture(calculate(text));
    }

    private ToolResult calculate(String expression) {
        double result;
        try {
            result = ExpressionEvaluator.evaluate(expression);
        } catch (IllegalArgumentException e) {
            log.debug("[Tools] Calculator rejected '{}': {}", expression, e.getMessage());
            return ToolResult.failure(ToolExecutionException.Kind.INVALID_ARGUMENTS,
                    "Invalid expression: " + e.getMessage());
        }
        if (Double.isNaN(result)) {
            return ToolResult.failure("Expression did not evaluate to a valid number");
        }
        String formatted = format(result);
        return ToolResult.success(expression.trim() + " = " + formatted,
                Map.of("expression", expression, "result", result, "formatted", formatted));
    }

    static String format(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "Infinity" : "-Infinity";
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        BigDecimal rounded = BigDecimal.valueOf(value).setScale(10, RoundingMode.HALF_UP).stripTrailingZeros();
        return rounded.toPlainString();
    }
}
