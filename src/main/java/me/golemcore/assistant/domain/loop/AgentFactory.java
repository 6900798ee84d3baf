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

import me.golemcore.assistant.domain.component.MemoryComponent;
import me.golemcore.assistant.domain.service.HistoryTrimmer;
import me.golemcore.assistant.domain.service.ProactiveContextService;
import me.golemcore.assistant.domain.service.SystemPromptBuilder;
import me.golemcore.assistant.domain.service.ToolCallValidator;
import me.golemcore.assistant.domain.service.ToolErrorFormatter;
import me.golemcore.assistant.domain.service.ToolRegistry;
import me.golemcore.assistant.domain.system.RetryPolicy;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.port.outbound.LlmPort;
import me.golemcore.assistant.port.outbound.SummarizerPort;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Executor;

/**
 * Creates one {@link AgentOrchestrator} per conversation, wired with the
 * shared services and a fresh {@link HistoryTrimmer}.
 */
@Component
public class AgentFactory {

    private final ObjectProvider<LlmPort> llmPort;
    private final ToolRegistry toolRegistry;
    private final ToolCallValidator validator;
    private final ToolErrorFormatter errorFormatter;
    private final SystemPromptBuilder promptBuilder;
    private final ObjectProvider<MemoryComponent> memory;
    private final ProactiveContextService proactiveContext;
    private final SummarizerPort summarizer;
    private final Executor backgroundExecutor;
    private final AssistantProperties properties;
    private final RetryPolicy retryPolicy = new RetryPolicy();

    public AgentFactory(ObjectProvider<LlmPort> llmPort, ToolRegistry toolRegistry, ToolCallValidator validator,
            ToolErrorFormatter errorFormatter, SystemPromptBuilder promptBuilder,
            ObjectProvider<MemoryComponent> memory, ProactiveContextService proactiveContext,
            SummarizerPort summarizer, @Qualifier("backgroundExecutor") Executor backgroundExecutor,
            AssistantProperties properties) {
        this.llmPort = llmPort;
        this.toolRegistry = toolRegistry;
        this.validator = validator;
        this.errorFormatter = errorFormatter;
        this.promptBuilder = promptBuilder;
        this.memory = memory;
        this.proactiveContext = proactiveContext;
        this.summarizer = summarizer;
        this.backgroundExecutor = backgroundExecutor;
        this.properties = properties;
    }

    public AgentOrchestrator create() {
        AssistantProperties.BudgetProperties budget = properties.getBudget();
        HistoryTrimmer trimmer = new HistoryTrimmer(summarizer, backgroundExecutor, budget.getMaxHistoryTokens(),
                budget.getSummarizationThreshold(), Duration.ofMillis(properties.getSummary().getTimeoutMs()));

        LlmPort provider = llmPort.getIfAvailable();
        return AgentOrchestrator.builder()
                .provider(provider != null && provider.isAvailable() ? provider : null)
                .toolRegistry(toolRegistry)
                .validator(validator)
                .errorFormatter(errorFormatter)
                .promptBuilder(promptBuilder)
                .trimmer(trimmer)
                .memory(memory.getIfAvailable())
                .proactiveContext(proactiveContext)
                .retryPolicy(retryPolicy)
                .config(properties.getAgent().toAgentConfig())
                .loopDetectionWindow(properties.getAgent().getLoopDetectionWindow())
                .build();
    }
}
