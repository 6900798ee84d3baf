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


package me.golemcore.assistant.domain.component;

import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolPriority;
import me.golemcore.assistant.domain.model.ToolResult;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

public interface ToolComponent extends Component {

    @Override
    default String getComponentType() {
        return "tool";
    }

    /**
     * Returns the tool definition with JSON Schema for function calling.
     *
     * @return the tool definition
     */
    ToolDefinition getDefinition();

    /**
     * Executes the tool with already parsed arguments.
     *
     * @param parameters
     *            the execution parameters as a map
     * @return a future containing the tool execution result
     */
    CompletableFuture<ToolResult> execute(Map<String, Object> parameters);

    default String getToolName() {
        return getDefinition().getName();
    }

    /**
     * Advertisement priority when the backend limits the number of tools.
     */
    default ToolPriority getPriority() {
        return ToolPriority.EXTENDED;
    }

    /**
     * Short human-readable capability, listed in the prompt when the tool is
     * disabled ("check the weather").
     */
    default String getCapability() {
        return getDefinition().getDescription();
    }
}
