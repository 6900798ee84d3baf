package me.golemcore.assistant.domain.model;

/**
 * A finished tool invocation, either run by the orchestrator or reported by a
 * backend that executes tools inside its own session.
 */
public record ToolExecution(String name, String arguments, String result, boolean success) {
}
