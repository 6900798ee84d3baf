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
 * Per-tool failure raised by the tool registry. The orchestrator always
 * recovers from it by feeding an error payload back to the model.
 */
@Getter
public class ToolExecutionException extends Exception {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        TOOL_NOT_FOUND, EXECUTION_FAILED, INVALID_ARGUMENTS, PERMISSION_DENIED
    }

    private final Kind kind;
    private final String toolName;

    public ToolExecutionException(Kind kind, String toolName, String message) {
        super(message);
        this.kind = kind;
        this.toolName = toolName;
    }

    public ToolExecutionException(Kind kind, String toolName, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.toolName = toolName;
    }

    public static ToolExecutionException notFound(String toolName) {
        return new ToolExecutionException(Kind.TOOL_NOT_FOUND, toolName,
                String.format("Tool '%s' not found.", toolName));
    }
}
