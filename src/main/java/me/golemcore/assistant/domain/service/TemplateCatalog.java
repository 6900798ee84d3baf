package me.golemcore.assistant.domain.service;

import me.golemcore.assistant.domain.model.ConversationTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bundled conversation templates and the arguments used to prefetch their
 * tools.
 */
@Component
public class TemplateCatalog {

    private static final List<ConversationTemplate> BUNDLED = List.of(
            ConversationTemplate.builder()
                    .id("morning_briefing")
                    .name("Morning Briefing")
                    .description("Weather, calendar, and reminders summary")
                    .systemPromptFocus("Give a concise morning briefing using the PREFETCHED DATA provided. "
                            + "Do NOT call tools again and do not invent data beyond it. If a section has no "
                            + "data, say \"nothing scheduled\" or \"no reminders\". Lead with weather, then "
                            + "events, then reminders.")
                    .toolNames(List.of("weather", "calendar", "reminders"))
                    .initialPrompt("Give me my morning briefing")
                    .build(),
            ConversationTemplate.builder()
                    .id("meeting_prep")
                    .name("Meeting Prep")
                    .description("Event details and attendee info")
                    .systemPromptFocus("Help prepare for meetings using the PREFETCHED DATA provided. Do NOT "
                            + "call tools again and do not invent event or attendee data. Show event details "
                            + "and attendee contact info, then suggest talking points.")
                    .toolNames(List.of("calendar", "contacts"))
                    .initialPrompt("Help me prepare for my next meeting")
                    .build(),
            ConversationTemplate.builder()
                    .id("research_mode")
                    .name("Research Mode")
                    .description("Web fetch with longer responses")
                    .systemPromptFocus("Help with research. Give detailed, well-structured responses. Save key "
                            + "findings to memory. Include sources when fetching web content.")
                    .toolNames(List.of("web_fetch", "remember"))
                    .build(),
            ConversationTemplate.builder()
                    .id("quick_math")
                    .name("Quick Math")
                    .description("Fast calculations, minimal chat")
                    .systemPromptFocus("Focus on math and calculations. Give the answer immediately with "
                            + "minimal explanation. Show the steps only if asked.")
                    .toolNames(List.of("calculator"))
                    .build());

    // Only read-only tools are prefetched.
    private static final Map<String, String> PREFETCH_ARGUMENTS = Map.of(
            "weather", "{}",
            "calendar", "{\"action\":\"list\"}",
            "reminders", "{\"action\":\"list\"}",
            "contacts", "{\"action\":\"list\"}");

    public List<ConversationTemplate> getAll() {
        return BUNDLED;
    }

    public Optional<ConversationTemplate> findById(String id) {
        if (id == null) {
            return Optional.empty();
        }
        return BUNDLED.stream().filter(template -> template.getId().equals(id)).findFirst();
    }

    public Optional<String> getPrefetchArguments(String toolName) {
        return Optional.ofNullable(PREFETCH_ARGUMENTS.get(toolName));
    }
}
