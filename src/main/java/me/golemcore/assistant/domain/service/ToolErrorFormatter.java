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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Turns a tool failure into the {@code {"error": ..., "suggestion": ...}}
 * payload fed back to the model, so it can explain the problem and propose a
 * fix instead of showing a raw error.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolErrorFormatter {

    private static final String FALLBACK_JSON = "{\"error\":\"Tool execution failed\"}";

    private final ObjectMapper objectMapper;

    public String format(ToolExecutionException error) {
        String message = error.getMessage() != null ? error.getMessage() : "Tool execution failed";
        ObjectNode node = objectMapper.createObjectNode();
        node.put("error", message);
        suggestionFor(error.getToolName(), error.getKind(), message)
                .ifPresent(suggestion -> node.put("suggestion", suggestion));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            log.warn("[Tools] Failed to encode tool error: {}", e.getMessage());
            return FALLBACK_JSON;
        }
    }

    Optional<String> suggestionFor(String toolName, ToolExecutionException.Kind kind, String message) {
        if (kind == ToolExecutionException.Kind.TOOL_NOT_FOUND) {
            return Optional.of("This tool is not available. Answer without it or use another available tool.");
        }
        String error = message.toLowerCase(Locale.ROOT);
        boolean accessDenied = kind == ToolExecutionException.Kind.PERMISSION_DENIED
                || error.contains("access") || error.contains("denied");
        String suggestion = switch (toolName != null ? toolName : "") {
            case "weather" -> {
                if (error.contains("location") || error.contains("denied")) {
                    yield "Try specifying a city name like 'weather in San Francisco'";
                }
                yield error.contains("timeout") || error.contains("timed out")
                        ? "Location request timed out. Please try again or specify a city name."
                        : null;
            }
            case "calendar" -> {
                if (accessDenied) {
                    yield "Calendar access is required. Please enable it in Settings > Privacy > Calendars.";
                }
                yield error.contains("title") ? "Please specify what event you'd like to create." : null;
            }
            case "contacts" -> accessDenied
                    ? "Contacts access is required. Please enable it in Settings > Privacy > Contacts."
                    : null;
            case "reminders" -> accessDenied
                    ? "Reminders access is required. Please enable it in Settings > Privacy > Reminders."
                    : null;
            case "location" -> kind == ToolExecutionException.Kind.PERMISSION_DENIED
                    || error.contains("denied") || error.contains("authorization")
                            ? "Location access is required. Please enable it in Settings > Privacy > Location Services."
                            : null;
            case "web_fetch" -> {
                if (error.contains("invalid") || error.contains("url")) {
                    yield "Please provide a valid URL starting with http:// or https://";
                }
                yield error.contains("timeout") || error.contains("timed out") || error.contains("network")
                        ? "Network error. Please check your connection and try again."
                        : null;
            }
            case "calculator" -> error.contains("expression") || error.contains("invalid")
                    ? "Please check the math expression format. Example: '100 * 0.15' for 15% of 100."
                    : null;
            default -> null;
        };
        return Optional.ofNullable(suggestion);
    }
}
