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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.port.outbound.LlmPort;
import me.golemcore.assistant.port.outbound.SummarizerPort;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

/**
 * Keeps one conversation's history under the history token budget.
 *
 * <p>
 * Removal order, lowest priority first: user messages, then assistant
 * messages, then tool results. The system message and the last two
 * non-system messages are never removed. Once usage passes the summarization
 * threshold, the older part of the conversation is summarized in the
 * background; at most one summarization runs at a time.
 */
@Slf4j
public class HistoryTrimmer {

    private static final int KEEP_RECENT = 2;
    private static final int SUMMARY_EXCLUDES_RECENT = 4;
    private static final int MIN_MESSAGES_AFTER_TRIM = 3;
    private static final int MAX_TRANSCRIPT_ENTRY_CHARS = 300;

    private final SummarizerPort summarizer;
    private final Executor executor;
    private final int maxHistoryTokens;
    private final double summarizationThreshold;
    private final Duration summaryTimeout;

    private final AtomicReference<String> summary = new AtomicReference<>();
    private final AtomicBoolean summarizing = new AtomicBoolean(false);
    private final AtomicInteger trimmedCount = new AtomicInteger();
    private final AtomicLong generation = new AtomicLong();

    public HistoryTrimmer(SummarizerPort summarizer, Executor executor, int maxHistoryTokens,
            double summarizationThreshold, Duration summaryTimeout) {
        this.summarizer = summarizer;
        this.executor = executor;
        this.maxHistoryTokens = maxHistoryTokens;
        this.summarizationThreshold = summarizationThreshold;
        this.summaryTimeout = summaryTimeout;
    }

    /**
     * Trims the list in place and may start a background summarization.
     *
     * @return number of messages removed by this call
     */
    public int trim(List<Message> messages) {
        if (messages.size() <= 2) {
            return 0;
        }

        int tokenCount = TokenEstimator.estimate(nonSystem(messages));
        double usage = maxHistoryTokens > 0 ? (double) tokenCount / maxHistoryTokens : 1.0;
        if (usage >= summarizationThreshold) {
            requestSummary(messages);
        }

        int maxIterations = messages.size();
        int iterations = 0;
        int removed = 0;
        while (tokenCount > maxHistoryTokens && messages.size() > MIN_MESSAGES_AFTER_TRIM
                && iterations < maxIterations) {
            iterations++;
            int index = findLowestPriorityIndex(messages);
            if (index < 0) {
                break;
            }
            Message dropped = messages.remove(index);
            tokenCount -= TokenEstimator.estimate(dropped);
            removed++;
        }

        if (removed > 0) {
            int total = trimmedCount.addAndGet(removed);
            log.info("[Trim] Trimmed {} messages, total trimmed: {} ({} history tokens left)", removed, total,
                    tokenCount);
        }
        if (iterations >= maxIterations) {
            log.warn("[Trim] Reached max iterations ({}), stopping", maxIterations);
        }
        return removed;
    }

    /**
     * Recovery after the backend rejected the context: summarizes everything but
     * the last two non-system messages synchronously, drops it, and tells the
     * backend to forget its cached session.
     *
     * @return number of messages removed
     */
    public int aggressiveTrim(List<Message> messages, LlmPort provider) {
        List<Message> history = nonSystem(messages);
        if (history.size() <= KEEP_RECENT) {
            provider.resetSession();
            return 0;
        }

        List<Message> older = history.subList(0, history.size() - KEEP_RECENT);
        String transcript = buildTranscript(older);
        String previous = summary.get();
        if (previous != null) {
            transcript = "Earlier summary: " + previous + "\n" + transcript;
        }
        summarizeNow(transcript).ifPresent(summary::set);

        List<Message> kept = new ArrayList<>();
        if (!messages.isEmpty() && messages.get(0).isSystemMessage()) {
            kept.add(messages.get(0));
        }
        kept.addAll(history.subList(history.size() - KEEP_RECENT, history.size()));
        int removed = messages.size() - kept.size();
        messages.clear();
        messages.addAll(kept);

        int total = trimmedCount.addAndGet(removed);
        log.warn("[Trim] Aggressive trim removed {} messages, total trimmed: {}, summary present: {}", removed,
                total, summary.get() != null);
        provider.resetSession();
        return removed;
    }

    public Optional<String> getSummary() {
        return Optional.ofNullable(summary.get());
    }

    public boolean isSummarizing() {
        return summarizing.get();
    }

    public int getMaxHistoryTokens() {
        return maxHistoryTokens;
    }

    public int getTrimmedCount() {
        return trimmedCount.get();
    }

    /**
     * Forgets the summary and the trimmed counter. A summarization still in
     * flight is discarded when it completes.
     */
    public void reset() {
        generation.incrementAndGet();
        summary.set(null);
        trimmedCount.set(0);
    }

    private void requestSummary(List<Message> messages) {
        if (summary.get() != null) {
            return;
        }
        List<Message> history = nonSystem(messages);
        if (history.size() <= SUMMARY_EXCLUDES_RECENT) {
            return;
        }
        String transcript = buildTranscript(history.subList(0, history.size() - SUMMARY_EXCLUDES_RECENT));
        if (transcript.isBlank() || !summarizing.compareAndSet(false, true)) {
            return;
        }

        long requestGeneration = generation.get();
        log.info("[Trim] Requesting background summary of {} messages", history.size() - SUMMARY_EXCLUDES_RECENT);
        try {
            CompletableFuture.supplyAsync(() -> summarizer.summarize(transcript), executor)
                    .thenCompose(Function.identity())
                    .whenComplete((result, error) -> {
                        try {
                            if (error != null) {
                                log.warn("[Trim] Background summary failed: {}", error.getMessage());
                            } else if (generation.get() != requestGeneration) {
                                log.debug("[Trim] Discarding summary of a reset conversation");
                            } else if (result != null && result.isPresent()) {
                                summary.set(result.get());
                                log.info("[Trim] Conversation summary ready ({} chars)", result.get().length());
                            }
                        } finally {
                            summarizing.set(false);
                        }
                    });
        } catch (RuntimeException e) {
            summarizing.set(false);
            log.warn("[Trim] Could not schedule summary: {}", e.getMessage());
        }
    }

    private Optional<String> summarizeNow(String transcript) {
        if (transcript.isBlank()) {
            return Optional.empty();
        }
        try {
            Optional<String> result = summarizer.summarize(transcript)
                    .get(summaryTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return result != null ? result : Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[Trim] Interrupted while summarizing");
            return Optional.empty();
        } catch (ExecutionException | TimeoutException e) {
            log.warn("[Trim] Synchronous summary failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Oldest user message, else oldest assistant message, else oldest tool
     * result, outside the protected tail. -1 when nothing is eligible.
     */
    private static int findLowestPriorityIndex(List<Message> messages) {
        int protectedFrom = protectedTailStart(messages);
        for (String role : List.of(Message.ROLE_USER, Message.ROLE_ASSISTANT, Message.ROLE_TOOL)) {
            for (int i = 0; i < protectedFrom; i++) {
                if (role.equals(messages.get(i).getRole())) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static int protectedTailStart(List<Message> messages) {
        int seen = 0;
        for (int i = messages.size() - 1; i >= 0; i--) {
            if (!messages.get(i).isSystemMessage()) {
                seen++;
                if (seen == KEEP_RECENT) {
                    return i;
                }
            }
        }
        return 0;
    }

    private static List<Message> nonSystem(List<Message> messages) {
        return messages.stream().filter(m -> !m.isSystemMessage()).toList();
    }

    static String buildTranscript(List<Message> messages) {
        StringBuilder sb = new StringBuilder();
        for (Message msg : messages) {
            if (msg.isToolMessage() || msg.getContent() == null || msg.getContent().isBlank()) {
                continue;
            }
            String content = msg.getContent();
            if (content.length() > MAX_TRANSCRIPT_ENTRY_CHARS) {
                content = content.substring(0, MAX_TRANSCRIPT_ENTRY_CHARS) + "...";
            }
            sb.append(msg.isUserMessage() ? "User" : "Assistant").append(": ").append(content).append("\n");
        }
        return sb.toString();
    }
}
