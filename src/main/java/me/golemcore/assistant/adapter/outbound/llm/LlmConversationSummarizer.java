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


package me.golemcore.assistant.adapter.outbound.llm;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.StreamChunk;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.port.outbound.LlmPort;
import me.golemcore.assistant.port.outbound.SummarizerPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Summarizes older conversation turns with the configured model. No tools are
 * advertised, and failures, timeouts and blank answers all produce an empty
 * result.
 */
@Service
@Slf4j
public class LlmConversationSummarizer implements SummarizerPort {

    private static final String SYSTEM_PROMPT = """
            Summarize the conversation below for a personal assistant that will continue it.
            Keep facts the user shared, their preferences, decisions made and open requests.
            Keep it factual. Do NOT include greetings, apologies or meta-commentary.
            Output only the summary, at most %d words.""";

    private final LlmPort llmPort;
    private final Duration timeout;
    private final int maxWords;
    private final Clock clock;

    public LlmConversationSummarizer(LlmPort llmPort, AssistantProperties properties, Clock clock) {
        this.llmPort = llmPort;
        this.timeout = Duration.ofMillis(properties.getSummary().getTimeoutMs());
        this.maxWords = Math.max(20, properties.getBudget().getSummaryMaxTokens() * 3 / 4);
        this.clock = clock;
    }

    @Override
    public CompletableFuture<Optional<String>> summarize(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return CompletableFuture.completedFuture(Optional.empty());
        }
        if (!llmPort.isAvailable()) {
            log.warn("[Summary] Model not available, cannot summarize");
            return CompletableFuture.completedFuture(Optional.empty());
        }

        List<Message> request = List.of(
                Message.system(String.format(SYSTEM_PROMPT, maxWords)),
                Message.user(transcript));
        long start = clock.millis();

        return llmPort.streamComplete(request, List.of())
                .filter(StreamChunk::hasContent)
                .map(StreamChunk::getContent)
                .reduce(new StringBuilder(), StringBuilder::append)
                .timeout(timeout)
                .map(text -> text.toString().trim())
                .flatMap(summary -> {
                    if (summary.isEmpty()) {
                        log.warn("[Summary] Model returned empty summary");
                        return Mono.just(Optional.<String>empty());
                    }
                    log.info("[Summary] Summarized {} chars of transcript in {}ms ({} chars)",
                            transcript.length(), clock.millis() - start, summary.length());
                    return Mono.just(Optional.of(summary));
                })
                .onErrorResume(error -> {
                    log.warn("[Summary] Summarization failed: {}", error.getMessage());
                    return Mono.just(Optional.empty());
                })
                .toFuture();
    }
}
