package me.golemcore.assistant.domain.model;

/**
 * Orchestrator states. A run moves forward through the list and ends in
 * {@link #DONE} or one of the two abort states.
 */
public enum AgentState {
    IDLE,
    PREPARING_PROMPT,
    TRIMMING,
    SELECTING_TOOLS,
    STREAMING,
    HANDLING_TOOL_CALLS,
    VALIDATING,
    DONE,
    MAX_ITERATIONS_REACHED,
    LOOP_DETECTED;

    public boolean isTerminal() {
        return this == DONE || this == MAX_ITERATIONS_REACHED || this == LOOP_DETECTED;
    }
}
