package me.golemcore.assistant.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Token usage of a conversation's history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextStatsDto {
    private int currentTokens;
    private int maxTokens;
    private double usagePercent;
    private int systemTokens;
    private int userTokens;
    private int assistantTokens;
    private int toolTokens;
    private int messageCount;
    private int trimmedCount;
    private boolean nearLimit;
    private boolean critical;
}
