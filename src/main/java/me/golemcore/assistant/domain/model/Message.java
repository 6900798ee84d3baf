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


package me.golemcore.assistant.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * A single entry of a conversation history. Roles are {@code system},
 * {@code user}, {@code assistant} and {@code tool}; insertion order is the
 * conversation order and index 0 holds the system message when present.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Message {

    public static final String ROLE_SYSTEM = "system";
    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";
    public static final String ROLE_TOOL = "tool";

    private String id;
    private String role; // system, user, assistant, tool
    private String content;

    private List<ToolCall> toolCalls;
    private String toolCallId; // For tool result messages
    private String toolName; // Tool name for tool result messages

    private Attachment attachment;
    private Instant timestamp;

    public static Message system(String content) {
        return of(ROLE_SYSTEM, content);
    }

    public static Message user(String content) {
        return of(ROLE_USER, content);
    }

    /**
     * Creates a user message carrying an attachment; a null attachment gives a
     * plain text message.
     */
    public static Message user(String content, Attachment attachment) {
        Message message = of(ROLE_USER, content);
        message.setAttachment(attachment);
        return message;
    }

    public boolean hasAttachment() {
        return attachment != null;
    }

    public static Message assistant(String content) {
        return of(ROLE_ASSISTANT, content);
    }

    public static Message assistant(String content, List<ToolCall> toolCalls) {
        Message message = of(ROLE_ASSISTANT, content);
        message.setToolCalls(toolCalls == null || toolCalls.isEmpty() ? null : List.copyOf(toolCalls));
        return message;
    }

    public static Message tool(String toolCallId, String toolName, String content) {
        Message message = of(ROLE_TOOL, content);
        message.setToolCallId(toolCallId);
        message.setToolName(toolName);
        return message;
    }

    private static Message of(String role, String content) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(role)
                .content(content != null ? content : "")
                .timestamp(Instant.now())
                .build();
    }

    public boolean isUserMessage() {
        return ROLE_USER.equals(role);
    }

    public boolean isAssistantMessage() {
        return ROLE_ASSISTANT.equals(role);
    }

    public boolean isSystemMessage() {
        return ROLE_SYSTEM.equals(role);
    }

    public boolean isToolMessage() {
        return ROLE_TOOL.equals(role);
    }

    /**
     * Checks if this message contains tool calls from the model.
     */
    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * A function call requested by the model. Arguments are kept as the raw
     * JSON text the model produced so that repeat signatures compare exactly.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ToolCall {
        private String id;
        private String name;
        private String arguments;

        /**
         * Loop-detection signature of this call: {@code name:arguments}.
         */
        public String signature() {
            return name + ":" + (arguments != null ? arguments : "");
        }
    }
}
