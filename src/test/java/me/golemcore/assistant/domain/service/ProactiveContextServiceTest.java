package me.golemcore.assistant.domain.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.ConversationTemplate;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;

import static org.junit.jupiter.api.Assertions.*;

class ProactiveContextServiceTest {

    private static final String WEATHER_QUESTION = "What's the weather in Paris?";

    private AssistantProperties properties;
    private TemplateCatalog templateCatalog;
    private Map<String, ToolResult> results;
    private Map<String, Map<String, Object>> calls;

    @BeforeEach
    void setUp() {
        properties = new AssistantProperties();
        properties.getProactive().setEnabled(true);
        templateCatalog = new TemplateCatalog();
        results = new ConcurrentHashMap<>();
        calls = new ConcurrentHashMap<>();
    }

    @Test
    void shouldDetectWeatherIntentWithLocation() {
        ProactiveContextService service = service("weather");

        List<ProactiveContextService.PrefetchRequest> intents = service.detectIntents(WEATHER_QUESTION);

        assertEquals(List.of(new ProactiveContextService.PrefetchRequest("weather", "{\"location\":\"Paris\"}",
                "weather")), intents);
    }

    @Test
    void shouldEncodeLocationWithControlCharactersAsJson() throws Exception {
        ProactiveContextService service = service("weather");

        String arguments = service.detectIntents("What's the weather in S\u00e3o\tPaulo \"Centro\"?").get(0)
                .arguments();

        JsonNode parsed = new ObjectMapper().readTree(arguments);
        assertEquals("S\u00e3o\tPaulo \"Centro\"", parsed.get("location").asText());
    }

    @Test
    void shouldDetectContextualWeatherAndCalendarIntents() {
        ProactiveContextService service = service();

        assertEquals("weather", service.detectIntents("Do I need an umbrella?").get(0).toolName());
        assertEquals("{}", service.detectIntents("Will it rain tomorrow?").get(0).arguments());
        assertEquals("calendar", service.detectIntents("Do I have any meetings tomorrow?").get(0).toolName());
        assertTrue(service.detectIntents("Hello there").isEmpty());
        assertTrue(service.detectIntents(null).isEmpty());
    }

    @Test
    void shouldInjectPrefetchedWeather() {
        results.put("weather", ToolResult.success("Paris: Sunny, 24°C"));
        ProactiveContextService service = service("weather");

        Optional<String> context = service.buildProactiveContext(WEATHER_QUESTION);

        assertEquals(Optional.of(ProactiveContextService.PROACTIVE_HEADER + "\n[weather] Paris: Sunny, 24°C"),
                context);
        assertEquals(Map.of("location", "Paris"), calls.get("weather"));
    }

    @Test
    void shouldReturnEmptyWhenDisabled() {
        properties.getProactive().setEnabled(false);
        results.put("weather", ToolResult.success("Sunny"));
        ProactiveContextService service = service("weather");

        assertTrue(service.buildProactiveContext(WEATHER_QUESTION).isEmpty());
        assertTrue(calls.isEmpty());
    }

    @Test
    void shouldSkipUnregisteredTools() {
        ProactiveContextService service = service("weather");

        assertTrue(service.buildProactiveContext("What's on my calendar?").isEmpty());
    }

    @Test
    void shouldLeaveOutFailedTools() {
        results.put("weather", ToolResult.failure("Location is required"));
        results.put("calendar", ToolResult.success("10:00 Standup"));
        ProactiveContextService service = service("weather", "calendar");

        Optional<String> context = service.buildProactiveContext("What's the weather and my schedule today?");

        assertTrue(context.isPresent());
        assertTrue(context.get().contains("[calendar] 10:00 Standup"));
        assertFalse(context.get().contains("[weather]"));
    }

    @Test
    void shouldPrefetchTemplateTools() {
        results.put("weather", ToolResult.success("Sunny, 24°C"));
        results.put("reminders", ToolResult.success("Buy milk"));
        ProactiveContextService service = service("weather", "reminders");
        ConversationTemplate briefing = templateCatalog.findById("morning_briefing").orElseThrow();

        Optional<String> context = service.prefetchTemplate(briefing);

        assertEquals(Optional.of(ProactiveContextService.PREFETCHED_HEADER
                + "\n[weather] Sunny, 24°C\n[reminders] Buy milk"), context);
        assertEquals(Map.of(), calls.get("weather"));
        assertEquals(Map.of("action", "list"), calls.get("reminders"));
    }

    @Test
    void shouldNotPrefetchTemplateWithoutReadOnlyTools() {
        results.put("calculator", ToolResult.success("4"));
        ProactiveContextService service = service("calculator");
        ConversationTemplate quickMath = templateCatalog.findById("quick_math").orElseThrow();

        assertTrue(service.prefetchTemplate(quickMath).isEmpty());
        assertTrue(calls.isEmpty());
    }

    @Test
    void shouldTruncateToCharacterBudget() {
        String context = ProactiveContextService.format("H", List.of("a", "b"),
                List.of("x".repeat(100), "y".repeat(100)), 60);

        assertEquals("H\n[a] " + "x".repeat(52) + "...", context);
    }

    private ProactiveContextService service(String... toolNames) {
        List<ToolComponent> tools = new ArrayList<>();
        for (String name : toolNames) {
            tools.add(tool(name));
        }
        ToolRegistry registry = new ToolRegistry(tools, properties, new ObjectMapper());
        return new ProactiveContextService(registry, templateCatalog, properties, Runnable::run, new ObjectMapper());
    }

    private ToolComponent tool(String name) {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple(name, name);
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                calls.put(name, parameters);
                return CompletableFuture.completedFuture(results.get(name));
            }
        };
    }
}
