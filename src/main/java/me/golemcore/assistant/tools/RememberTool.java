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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.MemoryComponent;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.MemoryFact;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import me.golemcore.assistant.domain.model.ToolPriority;
import me.golemcore.assistant.domain.model.ToolResult;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Saves a fact about the user to long-term memory.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RememberTool implements ToolComponent {

    public static final String TOOL_NAME = "remember";

    private final MemoryComponent memoryComponent;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("Save a fact about the user for future conversations, such as preferences, "
                        + "names or routines.")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                "content", Map.of(
                                        "type", "string",
                                        "description", "The fact to remember, e.g. 'Prefers metric units'"),
                                "topics", Map.of(
                                        "type", "array",
                                        "items", Map.of("type", "string"),
                                        "description", "Short keywords for the fact, e.g. ['units', 'weather']")),
                        "required", List.of("content")))
                .build();
    }

    @Override
    public ToolPriority getPriority() {
        return ToolPriority.IMPORTANT;
    }

    @Override
    public String getCapability() {
        return "remember facts about you";
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        Object content = parameters.get("content");
        if (!(content instanceof String text) || text.isBlank()) {
            return CompletableFuture.completedFuture(ToolResult.failure(
                    ToolExecutionException.Kind.INVALID_ARGUMENTS, "Missing required parameter: content"));
        }
        MemoryFact fact = memoryComponent.remember(text, topics(parameters.get("topics")));
        log.debug("[Tools] Remembered fact {}", fact.getId());
        return CompletableFuture.completedFuture(
                ToolResult.success("Remembered: " + fact.getContent(), Map.of("id", fact.getId())));
    }

    private static List<String> topics(Object raw) {
        List<String> topics = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item != null) {
                    topics.add(item.toString());
                }
            }
        } else if (raw instanceof String text) {
            for (String part : text.split(",")) {
                topics.add(part.trim());
            }
        }
        return topics;
    }
}
