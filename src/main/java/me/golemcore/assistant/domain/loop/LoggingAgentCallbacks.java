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


package me.golemcore.assistant.domain.loop;

import lombok.extern.slf4j.Slf4j;

/**
 * Callbacks that write run progress to the log, used for conversations driven
 * over HTTP where nobody watches the stream.
 */
@Slf4j
public class LoggingAgentCallbacks implements AgentCallbacks {

    private static final int MAX_LOGGED_CHARS = 200;

    private final String conversationId;

    public LoggingAgentCallbacks(String conversationId) {
        this.conversationId = conversationId;
    }

    @Override
    public void onToolCall(String name, String arguments) {
        log.info("[Agent] [{}] Tool call: {} {}", conversationId, name, truncate(arguments));
    }

    @Override
    public void onToolResult(String name, String result, boolean success) {
        log.info("[Agent] [{}] Tool result: {} (success: {}) {}", conversationId, name, success, truncate(result));
    }

    @Override
    public void onResponse(String content) {
        log.debug("[Agent] [{}] Response: {}", conversationId, truncate(content));
    }

    @Override
    public void onError(Throwable error) {
        log.warn("[Agent] [{}] Run failed: {}", conversationId, error.getMessage());
    }

    private static String truncate(String text) {
        if (text == null || text.length() <= MAX_LOGGED_CHARS) {
            return text;
        }
        return text.substring(0, MAX_LOGGED_CHARS) + "...";
    }
}
