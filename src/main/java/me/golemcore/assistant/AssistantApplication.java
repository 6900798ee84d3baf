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


package me.golemcore.assistant;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Assistant.
 *
 * <p>
 * GolemCore Assistant is the orchestration core of a personal-assistant agent.
 * It runs a bounded reason-act-observe loop between a language model and a set
 * of tools while keeping each conversation inside a fixed token budget.
 *
 * <h2>Key Features</h2>
 * <ul>
 * <li><b>Prompt budgeting</b> - capped system-prompt sections and
 * priority-based history trimming with background summarization</li>
 * <li><b>Tool-call validation</b> - intent checks, local arithmetic fallback
 * and hallucinated-action detection</li>
 * <li><b>Resilience</b> - exponential backoff for transient provider errors
 * and loop detection</li>
 * <li><b>Tools</b> - calculator, weather, web fetch and memory</li>
 * </ul>
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Input Layer        → ChatController
 * Domain Layer       → AgentOrchestrator, HistoryTrimmer, ToolCallValidator
 * Infrastructure     → Langchain4j, OkHttp/Feign tools, in-memory facts
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code assistant.*} prefix.
 *
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class AssistantApplication {

    public static void main(String[] args) {
        SpringApplication.run(AssistantApplication.class, args);
    }

}
