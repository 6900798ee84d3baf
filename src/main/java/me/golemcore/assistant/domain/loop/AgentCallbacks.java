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

/**
 * Progress notifications of an orchestrator run, for UI feedback. All methods
 * default to no-ops; implementations must return quickly.
 */
public interface AgentCallbacks {

    AgentCallbacks NONE = new AgentCallbacks() {
    };

    default void onThinking() {
    }

    default void onToolCall(String name, String arguments) {
    }

    default void onToolResult(String name, String result, boolean success) {
    }

    default void onStreamChunk(String chunk) {
    }

    default void onResponse(String content) {
    }

    default void onError(Throwable error) {
    }
}
