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
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.DisabledTool;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Registry of callable tools. Looks tools up by name, parses the model's JSON
 * arguments and waits for the result under a timeout. Does not touch
 * conversation history.
 */
@Service
@Slf4j
public class ToolRegistry {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final Map<String, ToolComponent> tools = new ConcurrentHashMap<>();
    private final Set<String> disabledNames;
    private final long timeoutSeconds;
    private final ObjectMapper objectMapper;

    public ToolRegistry(List<ToolComponent> toolComponents, AssistantProperties properties,
            ObjectMapper objectMapper) {
        this.disabledNames = new HashSet<>(properties.getTools().getDisabled());
        this.timeoutSeconds = properties.getTools().getTimeoutSeconds();
        this.objectMapper = objectMapper;
        for (ToolComponent tool : toolComponents) {
            registerTool(tool);
        }
        log.info("[Tools] Registered {} tools: {}", tools.size(), tools.keySet());
    }

    public void registerTool(ToolComponent tool) {
        tools.put(tool.getToolName(), tool);
    }

    /**
     * Runs a tool with the model's raw JSON arguments.
     *
     * @return the tool's output text
     * @throws ToolExecutionException
     *             if the tool is unknown or disabled, the arguments are not a
     *             JSON object, or the tool failed or timed out
     */
    public String execute(String name, String argumentsJson) throws ToolExecutionException {
        String toolName = sanitizeToolName(name);
        ToolComponent tool = findAvailable(toolName)
                .orElseThrow(() -> ToolExecutionException.notFound(toolName));
        Map<String, Object> arguments = parseArguments(toolName, argumentsJson);

        log.debug("[Tools] Executing '{}' with {}", toolName, arguments);
        ToolResult result;
        try {
            CompletableFuture<ToolResult> future = tool.execute(arguments);
            result = future.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while executing tool " + toolName);
        } catch (TimeoutException e) {
            throw new ToolExecutionException(ToolExecutionException.Kind.EXECUTION_FAILED, toolName,
                    "Tool '" + toolName + "' timed out after " + timeoutSeconds + "s", e);
        } catch (ExecutionException | RuntimeException e) {
            log.warn("[Tools] Tool '{}' failed: {}", toolName, safeCauseMessage(e));
            throw new ToolExecutionException(ToolExecutionException.Kind.EXECUTION_FAILED, toolName,
                    "Tool execution failed: " + safeCauseMessage(e), e);
        }

        if (result == null) {
            throw new ToolExecutionException(ToolExecutionException.Kind.EXECUTION_FAILED, toolName,
                    "Tool returned no result");
        }
        if (!result.isSuccess()) {
            ToolExecutionException.Kind kind = result.getFailureKind() != null
                    ? result.getFailureKind()
                    : ToolExecutionException.Kind.EXECUTION_FAILED;
            throw new ToolExecutionException(kind, toolName, result.getError());
        }
        return result.getOutput() != null ? result.getOutput() : "";
    }

    public boolean hasTool(String name) {
        return findAvailable(name).isPresent();
    }

    public Optional<ToolComponent> getTool(String name) {
        return findAvailable(name);
    }

    /**
     * Definitions of all available tools, most important first.
     */
    public List<ToolDefinition> getDefinitions() {
        return availableTools().stream()
                .map(ToolComponent::getDefinition)
                .toList();
    }

    /**
     * Definitions of the {@code maxTools} most important available tools.
     */
    public List<ToolDefinition> getDefinitionsLimited(int maxTools) {
        return availableTools().stream()
                .limit(Math.max(0, maxTools))
                .map(ToolComponent::getDefinition)
                .toList();
    }

    /**
     * Definitions of the named tools that are available, in priority order.
     */
    public List<ToolDefinition> getDefinitionsFor(Collection<String> names) {
        return availableTools().stream()
                .filter(tool -> names.contains(tool.getToolName()))
                .map(ToolComponent::getDefinition)
                .toList();
    }

    public List<DisabledTool> getDisabledToolDescriptions() {
        return tools.values().stream()
                .filter(tool -> !isAvailable(tool))
                .sorted(Comparator.comparing(ToolComponent::getToolName))
                .map(tool -> new DisabledTool(tool.getToolName(), tool.getCapability()))
                .toList();
    }

    private List<ToolComponent> availableTools() {
        return tools.values().stream()
                .filter(this::isAvailable)
                .sorted(Comparator.comparingInt((ToolComponent tool) -> tool.getPriority().getRank())
                        .thenComparing(ToolComponent::getToolName))
                .toList();
    }

    private Optional<ToolComponent> findAvailable(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tools.get(name)).filter(this::isAvailable);
    }

    private boolean isAvailable(ToolComponent tool) {
        return tool.isEnabled() && !disabledNames.contains(tool.getToolName());
    }

    private Map<String, Object> parseArguments(String toolName, String argumentsJson)
            throws ToolExecutionException {
        if (argumentsJson == null || argumentsJson.isBlank()) {
            return Map.of();
        }
        try {
            Map<String, Object> parsed = objectMapper.readValue(argumentsJson, ARGUMENTS_TYPE);
            return parsed != null ? parsed : Map.of();
        } catch (JsonProcessingException e) {
            throw new ToolExecutionException(ToolExecutionException.Kind.INVALID_ARGUMENTS, toolName,
                    "Invalid arguments for tool '" + toolName + "': expected a JSON object", e);
        }
    }

    private static String safeCauseMessage(Throwable error) {
        Throwable cursor = error;
        Throwable cause = cursor.getCause();
        while (cause != null && !cause.equals(cursor)) {
            cursor = cause;
            cause = cursor.getCause();
        }
        String message = cursor.getMessage();
        if (message == null || message.isBlank()) {
            message = cursor.getClass().getSimpleName();
        }
        return message;
    }

    /**
     * Strips special tokens some models leak into tool names, e.g.
     * {@code calculator<|channel|>commentary}.
     */
    private String sanitizeToolName(String name) {
        if (name == null) {
            return null;
        }
        String sanitized = name.replaceAll("[^a-zA-Z0-9_-].*", "");
        if (!sanitized.equals(name)) {
            log.warn("[Tools] Sanitized tool name: '{}' -> '{}'", name, sanitized);
        }
        return sanitized;
    }
}
