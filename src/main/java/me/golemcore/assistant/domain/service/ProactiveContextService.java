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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.model.ConversationTemplate;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches tool data ahead of the model call: for weather or calendar intents
 * detected in the user's message, and for the tools of a freshly selected
 * conversation template. Each tool call runs concurrently against its own
 * timeout; failed or slow tools are left out.
 */
@Service
@Slf4j
public class ProactiveContextService {

    static final String PROACTIVE_HEADER = "PROACTIVE CONTEXT (auto-fetched, may be useful):";
    static final String PREFETCHED_HEADER = "PREFETCHED DATA:";
    private static final int MIN_ENTRY_CHARS = 20;

    private static final List<String> STRONG_WEATHER_KEYWORDS = List.of("weather", "forecast", "temperature");

    private static final List<Pattern> CONTEXTUAL_WEATHER = compile(
            "\\b(?:is it|will it|going to)\\s+(?:rain|snow|be (?:cold|hot|warm|sunny|cloudy|windy))",
            "\\b(?:rain|snow)\\s+(?:today|tomorrow|tonight|this week|later)",
            "\\bdo i need\\s+(?:an?\\s+)?(?:umbrella|jacket|coat)\\b",
            "\\b(?:how(?:'s| is) the weather|what(?:'s| is) the (?:weather|temperature|forecast))\\b");

    private static final Pattern WEATHER_LOCATION = Pattern.compile(
            "(?:weather|forecast|temperature)\\s+(?:in|for|at)\\s+(.+?)(?:\\?|$|\\.)", Pattern.CASE_INSENSITIVE);

    private static final List<Pattern> CALENDAR = compile(
            "\\bwhat(?:'s| is|'re| are)\\s+(?:on\\s+)?(?:my\\s+)?(?:calendar|schedule|agenda)\\b",
            "\\b(?:schedule|meeting|appointment)\\b",
            "\\b(?:am i|are we)\\s+(?:busy|free|available)\\b",
            "\\bat \\d{1,2}(?::\\d{2})?\\s*(?:am|pm)\\b",
            "\\bnext (?:monday|tuesday|wednesday|thursday|friday|saturday|sunday)\\b",
            "\\bdo i have\\s+.{0,20}\\b(?:today|tomorrow|tonight|this week)\\b");

    private final ToolRegistry toolRegistry;
    private final TemplateCatalog templateCatalog;
    private final AssistantProperties.ProactiveProperties settings;
    private final Executor executor;
    private final ObjectMapper objectMapper;

    public ProactiveContextService(ToolRegistry toolRegistry, TemplateCatalog templateCatalog,
            AssistantProperties properties, @Qualifier("backgroundExecutor") Executor executor,
            ObjectMapper objectMapper) {
        this.toolRegistry = toolRegistry;
        this.templateCatalog = templateCatalog;
        this.objectMapper = objectMapper;
        this.settings = properties.getProactive();
        this.executor = executor;
    }

    /**
     * A tool call to run ahead of the model.
     */
    public record PrefetchRequest(String toolName, String arguments, String label) {
    }

    public boolean isEnabled() {
        return settings.isEnabled();
    }

    /**
     * Prefetches data for intents found in the message. Empty when disabled or
     * nothing was detected or fetched.
     */
    public Optional<String> buildProactiveContext(String userMessage) {
        if (!settings.isEnabled()) {
            return Optional.empty();
        }
        return prefetch(detectIntents(userMessage), Duration.ofMillis(settings.getTimeoutMs()), PROACTIVE_HEADER);
    }

    /**
     * Prefetches the read-only tools of a template.
     */
    public Optional<String> prefetchTemplate(ConversationTemplate template) {
        if (!template.hasToolRestriction()) {
            return Optional.empty();
        }
        List<PrefetchRequest> requests = new ArrayList<>();
        for (String toolName : template.getToolNames()) {
            templateCatalog.getPrefetchArguments(toolName)
                    .ifPresent(args -> requests.add(new PrefetchRequest(toolName, args, toolName)));
        }
        return prefetch(requests, Duration.ofMillis(settings.getTemplateTimeoutMs()), PREFETCHED_HEADER);
    }

    public List<PrefetchRequest> detectIntents(String message) {
        if (message == null || message.isBlank()) {
            return List.of();
        }
        String lower = message.toLowerCase(Locale.ROOT);
        List<PrefetchRequest> intents = new ArrayList<>();
        if (matchesWeather(lower)) {
            String args = extractWeatherLocation(message)
                    .map(this::locationArguments)
                    .orElse("{}");
            intents.add(new PrefetchRequest("weather", args, "weather"));
        }
        if (matchesAny(CALENDAR, lower)) {
            intents.add(new PrefetchRequest("calendar", "{\"action\":\"list\"}", "calendar"));
        }
        return intents;
    }

    Optional<String> prefetch(List<PrefetchRequest> requests, Duration timeout, String header) {
        List<PrefetchRequest> valid = requests.stream()
                .filter(request -> toolRegistry.hasTool(request.toolName()))
                .toList();
        if (valid.isEmpty()) {
            return Optional.empty();
        }
        log.info("[Proactive] Prefetching {}", valid.stream().map(PrefetchRequest::label).toList());

        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (PrefetchRequest request : valid) {
            futures.add(CompletableFuture.supplyAsync(() -> run(request), executor)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                    .exceptionally(error -> {
                        log.info("[Proactive] {} prefetch failed: {}", request.label(), rootMessage(error));
                        return null;
                    }));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        List<String> labels = new ArrayList<>();
        List<String> results = new ArrayList<>();
        for (int i = 0; i < valid.size(); i++) {
            String result = futures.get(i).join();
            if (result != null && !result.isBlank()) {
                labels.add(valid.get(i).label());
                results.add(result);
            }
        }
        if (results.isEmpty()) {
            return Optional.empty();
        }
        String context = format(header, labels, results, settings.getMaxChars());
        log.info("[Proactive] Injected {} chars of context", context.length());
        return Optional.of(context);
    }

    private String run(PrefetchRequest request) {
        try {
            return toolRegistry.execute(request.toolName(), request.arguments());
        } catch (ToolExecutionException e) {
            throw new CompletionException(e);
        }
    }

    static String format(String header, List<String> labels, List<String> results, int maxChars) {
        StringBuilder context = new StringBuilder(header);
        int remaining = maxChars;
        for (int i = 0; i < results.size(); i++) {
            String prefix = "\n[" + labels.get(i) + "] ";
            int available = remaining - prefix.length();
            if (available <= MIN_ENTRY_CHARS) {
                break;
            }
            String result = results.get(i);
            String truncated = result.length() > available ? result.substring(0, available - 3) + "..." : result;
            context.append(prefix).append(truncated);
            remaining -= prefix.length() + truncated.length();
        }
        return context.toString();
    }

    private static boolean matchesWeather(String lower) {
        for (String word : lower.split("[^\\p{Alnum}]+")) {
            if (STRONG_WEATHER_KEYWORDS.contains(word)) {
                return true;
            }
        }
        return matchesAny(CONTEXTUAL_WEATHER, lower);
    }

    private String locationArguments(String location) {
        try {
            return objectMapper.writeValueAsString(Map.of("location", location));
        } catch (JsonProcessingException e) {
            log.warn("[Proactive] Could not encode location '{}': {}", location, e.getMessage());
            return "{}";
        }
    }

    private static Optional<String> extractWeatherLocation(String message) {
        Matcher matcher = WEATHER_LOCATION.matcher(message);
        if (matcher.find()) {
            String location = matcher.group(1).trim();
            if (!location.isEmpty()) {
                return Optional.of(location);
            }
        }
        return Optional.empty();
    }

    private static boolean matchesAny(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            if (pattern.matcher(text).find()) {
                return true;
            }
        }
        return false;
    }

    private static List<Pattern> compile(String... regexes) {
        List<Pattern> patterns = new ArrayList<>();
        for (String regex : regexes) {
            patterns.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return Collections.unmodifiableList(patterns);
    }

    private static String rootMessage(Throwable error) {
        Throwable cursor = error;
        while (cursor.getCause() != null && cursor.getCause() != cursor) {
            cursor = cursor.getCause();
        }
        return cursor.getMessage() != null ? cursor.getMessage() : cursor.getClass().getSimpleName();
    }
}
