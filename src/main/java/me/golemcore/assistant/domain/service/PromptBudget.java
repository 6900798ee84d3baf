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

import lombok.Getter;

import java.util.Optional;

/**
 * Running token budget for the sections of one system prompt. Sections must
 * be offered in priority order; once the budget is spent every later section
 * is omitted entirely.
 */
public class PromptBudget {

    private static final String ELLIPSIS = "...";

    @Getter
    private final int totalBudget;
    @Getter
    private int usedTokens;

    public PromptBudget(int totalBudget) {
        if (totalBudget < 0) {
            throw new IllegalArgumentException("totalBudget must be non-negative: " + totalBudget);
        }
        this.totalBudget = totalBudget;
    }

    public int getRemaining() {
        return totalBudget - usedTokens;
    }

    public boolean isExhausted() {
        return getRemaining() <= 0;
    }

    /**
     * Accepts a section under its own cap.
     *
     * @return the text to include (whole or truncated), or empty when the
     *         section is omitted
     */
    public Optional<String> add(String text, int cap) {
        if (text == null || text.isBlank() || isExhausted() || cap <= 0) {
            return Optional.empty();
        }
        int effectiveCap = Math.min(cap, getRemaining());
        int cost = TokenEstimator.estimate(text);
        if (cost <= effectiveCap) {
            usedTokens += cost;
            return Optional.of(text);
        }

        int maxChars = TokenEstimator.charsForTokens(effectiveCap) - ELLIPSIS.length();
        if (maxChars <= 0) {
            return Optional.empty();
        }
        usedTokens += effectiveCap;
        return Optional.of(text.substring(0, Math.min(maxChars, text.length())) + ELLIPSIS);
    }
}
