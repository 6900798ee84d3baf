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


package me.golemcore.assistant.adapter.outbound.llm;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ImageContent;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.TextContent;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.json.JsonArraySchema;
import dev.langchain4j.model.chat.request.json.JsonBooleanSchema;
import dev.langchain4j.model.chat.request.json.JsonEnumSchema;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonSchemaElement;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.model.Attachment;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.StreamChunk;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.port.outbound.LlmPort;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Base64;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Model backend for any OpenAI-compatible chat API (OpenRouter by default),
 * built on langchain4j.
 *
 * <p>
 * The blocking chat call runs on the bounded-elastic scheduler and is emitted
 * as a short stream: the text chunk, then the tool-call chunk, then the
 * completion marker. langchain4j retries are switched off; the orchestrator
 * owns retries.
 *
 * <p>
 * Tool messages are only sent as structured tool results when the assistant
 * message that requested them is still in the history. Trimming can break
 * that pairing; unpaired calls and results are flattened to plain assistant
 * text, which every provider accepts.
 */
@Component
@Slf4j
public class Langchain4jAdapter implements LlmPort {

    private static final String SCHEMA_KEY_PROPERTIES = "properties";

    private final AssistantProperties.LlmProperties settings;
    private final ChatModel chatModel;

    @Autowired
    public Langchain4jAdapter(AssistantProperties properties) {
        this(properties, createModel(properties.getLlm()));
    }

    Langchain4jAdapter(AssistantProperties properties, ChatModel chatModel) {
        this.settings = properties.getLlm();
        this.chatModel = chatModel;
    }

    private static ChatModel createModel(AssistantProperties.LlmProperties llm) {
        if (llm.getApiKey() == null || llm.getApiKey().isBlank()) {
            log.warn("[LLM] No API key configured for provider '{}'", llm.getProviderName());
            return null;
        }
        var builder = OpenAiChatModel.builder()
                .apiKey(llm.getApiKey())
                .modelName(llm.getModel())
                .maxRetries(0)
                .timeout(Duration.ofMillis(llm.getTimeoutMs()));
        if (llm.getBaseUrl() != null && !llm.getBaseUrl().isBlank()) {
            builder.baseUrl(llm.getBaseUrl());
        }
        if (llm.getTemperature() != null) {
            builder.temperature(llm.getTemperature());
        }
        log.info("[LLM] Using model {} via {}", llm.getModel(), llm.getProviderName());
        return builder.build();
    }

    @Override
    public String getProviderId() {
        return settings.getProviderName();
    }

    @Override
    public boolean isAvailable() {
        return chatModel != null;
    }

    @Override
    public int getMaxTools() {
        return settings.getMaxTools() > 0 ? settings.getMaxTools() : Integer.MAX_VALUE;
    }

    @Override
    public Flux<StreamChunk> streamComplete(List<Message> messages, List<ToolDefinition> tools) {
        return Flux.defer(() -> {
            if (chatModel == null) {
                return Flux.error(new IllegalStateException("Model provider '" + settings.getProviderName()
                        + "' is not configured"));
            }
            ChatRequest.Builder request = ChatRequest.builder().messages(convertMessages(messages));
            if (tools != null && !tools.isEmpty()) {
                request.toolSpecifications(tools.stream().map(Langchain4jAdapter::convertToolDefinition).toList());
            }
            log.debug("[LLM] Sending {} messages with {} tools", messages.size(), tools != null ? tools.size() : 0);
            ChatResponse response = chatModel.chat(request.build());
            return Flux.fromIterable(toChunks(response));
        }).subscribeOn(Schedulers.boundedElastic());
    }

    static List<StreamChunk> toChunks(ChatResponse response) {
        List<StreamChunk> chunks = new ArrayList<>();
        AiMessage aiMessage = response.aiMessage();
        if (aiMessage.text() != null && !aiMessage.text().isEmpty()) {
            chunks.add(StreamChunk.text(aiMessage.text()));
        }
        if (aiMessage.hasToolExecutionRequests()) {
            List<Message.ToolCall> calls = aiMessage.toolExecutionRequests().stream()
                    .map(request -> Message.ToolCall.builder()
                            .id(request.id())
                            .name(request.name())
                            .arguments(request.arguments() != null ? request.arguments() : "{}")
                            .build())
                    .toList();
            chunks.add(StreamChunk.toolCalls(calls));
        }
        chunks.add(StreamChunk.completed());
        return chunks;
    }

    static List<ChatMessage> convertMessages(List<Message> history) {
        Set<String> answeredCallIds = new HashSet<>();
        for (Message message : history) {
            if (message.isToolMessage() && message.getToolCallId() != null) {
                answeredCallIds.add(message.getToolCallId());
            }
        }

        List<ChatMessage> converted = new ArrayList<>();
        Set<String> requestedCallIds = new HashSet<>();
        for (Message message : history) {
            switch (message.getRole()) {
            case Message.ROLE_SYSTEM -> converted.add(SystemMessage.from(message.getContent()));
            case Message.ROLE_USER -> converted.add(convertUserMessage(message));
            case Message.ROLE_ASSISTANT -> {
                if (message.hasToolCalls() && allAnswered(message.getToolCalls(), answeredCallIds)) {
                    List<ToolExecutionRequest> requests = message.getToolCalls().stream()
                            .map(call -> ToolExecutionRequest.builder()
                                    .id(call.getId())
                                    .name(call.getName())
                                    .arguments(call.getArguments() != null ? call.getArguments() : "{}")
                                    .build())
                            .toList();
                    message.getToolCalls().forEach(call -> requestedCallIds.add(call.getId()));
                    converted.add(message.getContent().isBlank()
                            ? AiMessage.from(requests)
                            : AiMessage.from(message.getContent(), requests));
                } else if (message.hasToolCalls()) {
                    converted.add(AiMessage.from(flattenCalls(message)));
                } else {
                    converted.add(AiMessage.from(message.getContent()));
                }
            }
            case Message.ROLE_TOOL -> {
                if (requestedCallIds.contains(message.getToolCallId())) {
                    converted.add(ToolExecutionResultMessage.from(message.getToolCallId(), message.getToolName(),
                            message.getContent()));
                } else {
                    converted.add(AiMessage.from("[Tool result: " + message.getToolName() + "]\n"
                            + message.getContent()));
                }
            }
            default -> log.warn("[LLM] Unknown message role: {}, skipping", message.getRole());
            }
        }
        return converted;
    }

    static UserMessage convertUserMessage(Message message) {
        Attachment attachment = message.getAttachment();
        if (attachment == null) {
            return UserMessage.from(message.getContent());
        }
        if (attachment.isImage()) {
            String mimeType = attachment.getMimeType() != null ? attachment.getMimeType() : "image/png";
            ImageContent image = ImageContent.from(Base64.getEncoder().encodeToString(attachment.getData()), mimeType);
            return message.getContent().isBlank()
                    ? UserMessage.from(image)
                    : UserMessage.from(TextContent.from(message.getContent()), image);
        }
        // Providers only take images inline; other attachments are described in text.
        String name = attachment.getFilename() != null ? attachment.getFilename() : "document";
        String note = attachment.getCaption() != null && !attachment.getCaption().isBlank()
                ? "[Attached: " + name + " - " + attachment.getCaption() + "]"
                : "[Attached: " + name + "]";
        return UserMessage.from(message.getContent().isBlank() ? note : message.getContent() + "\n" + note);
    }

    private static boolean allAnswered(List<Message.ToolCall> calls, Set<String> answeredCallIds) {
        return calls.stream().allMatch(call -> call.getId() != null && answeredCallIds.contains(call.getId()));
    }

    private static String flattenCalls(Message message) {
        StringBuilder text = new StringBuilder();
        if (!message.getContent().isBlank()) {
            text.append(message.getContent()).append('\n');
        }
        for (Message.ToolCall call : message.getToolCalls()) {
            text.append("[Tool call: ").append(call.getName()).append(' ').append(call.getArguments()).append("]\n");
        }
        return text.toString().trim();
    }

    @SuppressWarnings("unchecked")
    static ToolSpecification convertToolDefinition(ToolDefinition tool) {
        ToolSpecification.Builder builder = ToolSpecification.builder()
                .name(tool.getName())
                .description(tool.getDescription());

        Map<String, Object> schema = tool.getInputSchema();
        if (schema != null && schema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> properties) {
            JsonObjectSchema.Builder parameters = JsonObjectSchema.builder();
            for (Map.Entry<?, ?> entry : properties.entrySet()) {
                parameters.addProperty(entry.getKey().toString(),
                        toJsonSchemaElement((Map<String, Object>) entry.getValue()));
            }
            if (schema.get("required") instanceof List<?> required && !required.isEmpty()) {
                parameters.required(required.stream().map(Object::toString).toList());
            }
            builder.parameters(parameters.build());
        }
        return builder.build();
    }

    @SuppressWarnings("unchecked")
    private static JsonSchemaElement toJsonSchemaElement(Map<String, Object> paramSchema) {
        String type = paramSchema.get("type") instanceof String t ? t : "string";
        String description = paramSchema.get("description") instanceof String d && !d.isBlank() ? d : null;

        if (paramSchema.get("enum") instanceof List<?> enumValues && !enumValues.isEmpty()) {
            return JsonEnumSchema.builder()
                    .enumValues(enumValues.stream().map(Object::toString).toList())
                    .description(description)
                    .build();
        }

        return switch (type) {
        case "integer" -> JsonIntegerSchema.builder().description(description).build();
        case "number" -> JsonNumberSchema.builder().description(description).build();
        case "boolean" -> JsonBooleanSchema.builder().description(description).build();
        case "array" -> {
            JsonArraySchema.Builder array = JsonArraySchema.builder().description(description);
            if (paramSchema.get("items") instanceof Map<?, ?> items) {
                array.items(toJsonSchemaElement((Map<String, Object>) items));
            } else {
                array.items(JsonStringSchema.builder().build());
            }
            yield array.build();
        }
        case "object" -> {
            JsonObjectSchema.Builder object = JsonObjectSchema.builder().description(description);
            if (paramSchema.get(SCHEMA_KEY_PROPERTIES) instanceof Map<?, ?> nested) {
                for (Map.Entry<?, ?> entry : nested.entrySet()) {
                    object.addProperty(entry.getKey().toString(),
                            toJsonSchemaElement((Map<String, Object>) entry.getValue()));
                }
            }
            yield object.build();
        }
        default -> JsonStringSchema.builder().description(description).build();
        };
    }
}
