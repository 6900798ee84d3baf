package me.golemcore.assistant.domain.model;

/**
 * Final answer of one orchestrator run.
 *
 * @param content
 *            text shown to the user, already appended to history as an
 *            assistant message
 * @param outcome
 *            how the run terminated
 * @param wasAborted
 *            true only when the caller cancelled the run
 * @param modelCalls
 *            number of model calls issued during the run, retries excluded
 */
public record AgentRunResult(String content, RunOutcome outcome, boolean wasAborted, int modelCalls) {

    public enum RunOutcome {
        COMPLETED, CREATIVE_REDIRECT, LOCAL_FALLBACK, LOOP_DETECTED, ABORTED
    }

    public static AgentRunResult aborted() {
        return new AgentRunResult("", RunOutcome.ABORTED, true, 0);
    }
}
