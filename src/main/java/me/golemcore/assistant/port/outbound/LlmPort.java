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


package me.golemcore.assistant.port.outbound;

import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.StreamChunk;
import me.golemcore.assistant.domain.model.ToolDefinition;
import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Port for the language-model backend. Each call to
 * {@link #streamComplete(List, List)} returns a cold, finite stream that is
 * consumed once.
 */
public interface LlmPort {

    /**
     * Returns the provider identifier (e.g. "openrouter").
     */
    String getProviderId();

    /**
     * Streams a completion for the given history, advertising the given tools.
     * An empty tool list means the model must answer in plain text.
     */
    Flux<StreamChunk> streamComplete(List<Message> messages, List<ToolDefinition> tools);

    /**
     * Drops any session state cached by the backend. Called after the history
     * was rewritten underneath it.
     */
    default void resetSession() {
    }

    /**
     * Maximum number of tools the backend accepts per request.
     */
    default int getMaxTools() {
        return Integer.MAX_VALUE;
    }

    /**
     * True when the backend runs tools inside its own session and reports
     * {@link me.golemcore.assistant.domain.model.ToolExecution executions}
     * instead of requesting calls.
     */
    default boolean handlesToolsNatively() {
        return false;
    }

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
