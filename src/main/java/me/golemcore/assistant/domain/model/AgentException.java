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

import lombok.Getter;

/**
 * Run-level failure surfaced to the caller of the orchestrator.
 */
@Getter
public class AgentException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        MAX_ITERATIONS_REACHED, NO_PROVIDER
    }

    private final Kind kind;

    public AgentException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static AgentException maxIterationsReached() {
        return new AgentException(Kind.MAX_ITERATIONS_REACHED,
                "Maximum iterations reached. The agent may be stuck in a loop.");
    }

    public static AgentException noProvider() {
        return new AgentException(Kind.NO_PROVIDER, "No LLM provider configured.");
    }
}
