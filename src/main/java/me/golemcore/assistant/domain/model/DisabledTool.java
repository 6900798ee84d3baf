package me.golemcore.assistant.domain.model;

/**
 * A tool switched off by configuration, advertised in the prompt so the model
 * can tell the user the feature exists.
 */
public record DisabledTool(String name, String capability) {
}
