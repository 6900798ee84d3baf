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


package me.golemcore.assistant.domain.service;

import lombok.Builder;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.model.DisabledTool;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Assembles the system prompt from sections in fixed priority order under the
 * system token reserve. Sections that no longer fit are dropped silently, so
 * a long summary can push out memories and prefetched data.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SystemPromptBuilder {

    static final String CORE_INSTRUCTIONS = """
            You are a personal assistant.

            ALWAYS USE TOOLS FOR:
            - Weather, temperature, forecast -> weather
            - Math, percentages, tips, conversions -> calculator
            - Schedule, meetings, events -> calendar
            - Reminders, tasks, to-dos -> reminders
            - "Remember that...", preferences -> remember
            - URLs and web pages -> web_fetch

            ANSWER DIRECTLY (no tools): greetings, general knowledge, opinions, date and time.

            EXAMPLE: "What's 20% of 85?" -> calculator(expression="85 * 0.20")

            RESPONSE RULES:
            - Be brief (1-2 sentences)
            - State the result, not the process
            - If a tool fails, explain and suggest an alternative
            - Never claim an action was done unless a tool did it""";

    private final AssistantProperties properties;

    public String build(PromptSections sections) {
        AssistantProperties.BudgetProperties budgetProperties = properties.getBudget();
        AssistantProperties.SectionCaps caps = budgetProperties.getSections();
        PromptBudget budget = new PromptBudget(budgetProperties.getSystemReserve());

        StringBuilder prompt = new StringBuilder();
        budget.add(CORE_INSTRUCTIONS, caps.getCore()).ifPresent(prompt::append);

        append(prompt, budget.add(sections.getTemplateFocus(), caps.getTemplate()), "FOCUS: ");
        append(prompt, budget.add(sections.getSummary(), caps.getSummary()), "CONVERSATION SUMMARY:\n");
        append(prompt, budget.add(sections.getMemories(), caps.getMemories()), "CONTEXT:\n");
        append(prompt, budget.add(sections.getProactiveContext(), caps.getProactive()), "");
        append(prompt, budget.add(formatDisabledTools(sections.getDisabledTools()), caps.getDisabledTools()),
                "DISABLED FEATURES (tell user to enable in Settings if they ask for these):\n");

        log.debug("[Prompt] System prompt built: {} of {} tokens used", budget.getUsedTokens(),
                budget.getTotalBudget());
        return prompt.toString();
    }

    private static void append(StringBuilder prompt, Optional<String> section, String header) {
        section.ifPresent(text -> {
            if (prompt.length() > 0) {
                prompt.append("\n\n");
            }
            prompt.append(header).append(text);
        });
    }

    private static String formatDisabledTools(List<DisabledTool> disabledTools) {
        if (disabledTools == null || disabledTools.isEmpty()) {
            return null;
        }
        return disabledTools.stream()
                .map(tool -> "- " + tool.name() + ": " + tool.capability())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Optional inputs of one prompt build, each nullable.
     */
    @Value
    @Builder
    public static class PromptSections {
        String templateFocus;
        String summary;
        String memories;
        String proactiveContext;
        List<DisabledTool> disabledTools;
    }
}
