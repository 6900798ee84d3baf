package me.golemcore.assistant.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Preset that focuses a conversation on a task: an extra prompt section, a
 * narrowed tool set and an optional opening prompt.
 */
@Data
@Builder
public class ConversationTemplate {

    private String id;
    private String name;
    private String description;
    private String systemPromptFocus;
    private List<String> toolNames;
    private String initialPrompt;

    public boolean hasToolRestriction() {
        return toolNames != null && !toolNames.isEmpty();
    }
}
