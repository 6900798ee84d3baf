package me.golemcore.assistant.domain.model;

/**
 * Snapshot of context-window usage for one conversation. Derived on demand,
 * never stored.
 */
public record ContextStats(
        int currentTokens,
        int maxTokens,
        double usagePercent,
        int systemTokens,
        int userTokens,
        int assistantTokens,
        int toolTokens,
        int messageCount,
        int trimmedCount) {

    private static final double NEAR_LIMIT = 0.8;
    private static final double CRITICAL = 0.95;

    public static final ContextStats EMPTY = new ContextStats(0, 0, 0.0, 0, 0, 0, 0, 0, 0);

    public boolean isNearLimit() {
        return usagePercent >= NEAR_LIMIT;
    }

    public boolean isCritical() {
        return usagePercent >= CRITICAL;
    }
}
