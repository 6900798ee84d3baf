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


package me.golemcore.assistant.adapter.outbound.memory;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.component.MemoryComponent;
import me.golemcore.assistant.domain.model.MemoryFact;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Process-local store of user facts.
 *
 * <p>
 * Facts read into a prompt gain confidence (+0.05, at most 1.0); facts left
 * out lose a little (-0.01, at least 0.1), so facts that never turn out to be
 * relevant sink over time.
 *
 * <p>
 * Relevance score per fact:
 * <ul>
 * <li>topic overlap with the conversation - 40%
 * <li>confidence - 30%
 * <li>recency of last access, decaying to zero over 90 days - 20%
 * <li>baseline - 10%
 * </ul>
 */
@Component
@Slf4j
public class InMemoryMemoryComponent implements MemoryComponent {

    static final int MAX_PROMPT_FACTS = 20;
    static final int MAX_RELEVANT_FACTS = 10;
    private static final double UNTAGGED_TOPIC_SCORE = 0.04;
    private static final double RECENCY_WINDOW_DAYS = 90.0;
    private static final double ACCESS_BOOST = 0.05;
    private static final double IDLE_DECAY = 0.01;
    private static final double MIN_CONFIDENCE = 0.1;

    private final Clock clock;
    private final List<MemoryFact> facts = new ArrayList<>();

    public InMemoryMemoryComponent(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized MemoryFact remember(String content, List<String> topics) {
        if (content == null || content.isBlank()) {
            throw new IllegalArgumentException("Fact content must not be blank");
        }
        Instant now = clock.instant();
        MemoryFact fact = MemoryFact.builder()
                .id(UUID.randomUUID().toString())
                .content(content.trim())
                .topics(normalize(topics))
                .createdAt(now)
                .lastAccessedAt(now)
                .build();
        facts.add(fact);
        log.info("[Memory] Stored fact with topics {}", fact.getTopics());
        return fact;
    }

    @Override
    public synchronized Optional<String> getForPrompt() {
        if (facts.isEmpty()) {
            return Optional.empty();
        }
        List<MemoryFact> ranked = facts.stream()
                .sorted(Comparator.comparingDouble(MemoryFact::getConfidence).reversed())
                .limit(MAX_PROMPT_FACTS)
                .toList();
        markAccessed(ranked);
        log.debug("[Memory] Including {} facts in prompt", ranked.size());
        return Optional.of(format(ranked));
    }

    @Override
    public synchronized Optional<String> getRelevantForConversation(List<String> topics) {
        if (facts.isEmpty() || topics == null || topics.isEmpty()) {
            return getForPrompt();
        }
        Set<String> conversationTopics = new HashSet<>(normalize(topics));
        Instant now = clock.instant();

        List<MemoryFact> top = facts.stream()
                .sorted(Comparator.comparingDouble((MemoryFact fact) -> score(fact, conversationTopics, now))
                        .reversed())
                .limit(MAX_RELEVANT_FACTS)
                .toList();
        markAccessed(top);
        log.debug("[Memory] Including {} relevant facts in prompt", top.size());
        return Optional.of(format(top));
    }

    public synchronized List<MemoryFact> getAll() {
        return List.copyOf(facts);
    }

    public synchronized void clear() {
        facts.clear();
    }

    static double score(MemoryFact fact, Set<String> conversationTopics, Instant now) {
        double score = 0.0;
        if (fact.getTopics() != null && !fact.getTopics().isEmpty()) {
            long overlap = fact.getTopics().stream().filter(conversationTopics::contains).count();
            score += 0.4 * overlap / conversationTopics.size();
        } else {
            score += UNTAGGED_TOPIC_SCORE;
        }
        score += 0.3 * fact.getConfidence();

        Instant lastAccess = fact.getLastAccessedAt() != null ? fact.getLastAccessedAt() : fact.getCreatedAt();
        double days = Duration.between(lastAccess, now).toSeconds() / 86400.0;
        score += 0.2 * Math.max(0.0, 1.0 - days / RECENCY_WINDOW_DAYS);

        return score + 0.1;
    }

    private void markAccessed(List<MemoryFact> accessed) {
        Instant now = clock.instant();
        Set<String> ids = accessed.stream().map(MemoryFact::getId).collect(Collectors.toSet());
        for (MemoryFact fact : facts) {
            if (ids.contains(fact.getId())) {
                fact.setConfidence(Math.min(1.0, fact.getConfidence() + ACCESS_BOOST));
                fact.setLastAccessedAt(now);
            } else {
                fact.setConfidence(Math.max(MIN_CONFIDENCE, fact.getConfidence() - IDLE_DECAY));
            }
        }
    }

    private static String format(List<MemoryFact> ranked) {
        return "USER FACTS:\n" + ranked.stream()
                .map(fact -> fact.getTopics() != null && !fact.getTopics().isEmpty()
                        ? "- " + fact.getContent() + " [" + String.join(", ", fact.getTopics()) + "]"
                        : "- " + fact.getContent())
                .collect(Collectors.joining("\n"));
    }

    private static List<String> normalize(List<String> topics) {
        if (topics == null) {
            return List.of();
        }
        return topics.stream()
                .filter(topic -> topic != null && !topic.isBlank())
                .map(topic -> topic.trim().toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
    }
}
