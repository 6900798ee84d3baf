package me.golemcore.assistant.domain.loop;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.assistant.domain.component.MemoryComponent;
import me.golemcore.assistant.domain.component.ToolComponent;
import me.golemcore.assistant.domain.model.AgentConfig;
import me.golemcore.assistant.domain.model.AgentException;
import me.golemcore.assistant.domain.model.AgentRunResult;
import me.golemcore.assistant.domain.model.AgentRunResult.RunOutcome;
import me.golemcore.assistant.domain.model.AgentState;
import me.golemcore.assistant.domain.model.Attachment;
import me.golemcore.assistant.domain.model.ContextStats;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.StreamChunk;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolExecution;
import me.golemcore.assistant.domain.model.ToolPriority;
import me.golemcore.assistant.domain.model.ToolResult;
import me.golemcore.assistant.domain.service.HistoryTrimmer;
import me.golemcore.assistant.domain.service.ProactiveContextService;
import me.golemcore.assistant.domain.service.SystemPromptBuilder;
import me.golemcore.assistant.domain.service.TemplateCatalog;
import me.golemcore.assistant.domain.service.ToolCallValidator;
import me.golemcore.assistant.domain.service.ToolErrorFormatter;
import me.golemcore.assistant.domain.service.ToolRegistry;
import me.golemcore.assistant.domain.system.RetryPolicy;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.port.outbound.LlmPort;
import me.golemcore.assistant.port.outbound.SummarizerPort;
import me.golemcore.assistant.tools.CalculatorTool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.net.SocketTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class AgentOrchestratorTest {

    private static final String PERCENT_QUESTION = "What's 20% of 85?";
    private static final String WEATHER_QUESTION = "What's the weather in Paris?";
    private static final String SUMMARY = "User asked about travel plans.";

    private LlmPort provider;
    private SummarizerPort summarizer;
    private AssistantProperties properties;
    private AtomicInteger weatherCalls;
    private AgentCallbacks callbacks;

    @BeforeEach
    void setUp() {
        provider = mock(LlmPort.class);
        when(provider.isAvailable()).thenReturn(true);
        when(provider.getMaxTools()).thenReturn(10);
        when(provider.getProviderId()).thenReturn("test");

        summarizer = mock(SummarizerPort.class);
        when(summarizer.summarize(anyString()))
                .thenReturn(CompletableFuture.completedFuture(Optional.of(SUMMARY)));

        properties = new AssistantProperties();
        weatherCalls = new AtomicInteger();
        callbacks = mock(AgentCallbacks.class);
    }

    // ===== Tool round trip =====

    @Test
    void shouldAnswerPercentQuestionWithCalculator() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(
                toolCall("call_1", "calculator", "{\"expression\":\"85 * 0.2\"}"),
                text("20% of 85 is 17."));

        AgentRunResult result = orchestrator.run(PERCENT_QUESTION, callbacks);

        assertEquals("20% of 85 is 17.", result.content());
        assertEquals(RunOutcome.COMPLETED, result.outcome());
        assertFalse(result.wasAborted());
        assertEquals(2, result.modelCalls());
        assertEquals(AgentState.DONE, orchestrator.getState());

        List<Message> history = orchestrator.getHistory();
        assertEquals(5, history.size());
        assertTrue(history.get(0).isSystemMessage());
        assertEquals(PERCENT_QUESTION, history.get(1).getContent());
        assertEquals("calculator", history.get(2).getToolCalls().get(0).getName());
        assertEquals("call_1", history.get(3).getToolCallId());
        assertEquals("85 * 0.2 = 17", history.get(3).getContent());
        assertEquals("20% of 85 is 17.", history.get(4).getContent());

        verify(callbacks).onToolCall("calculator", "{\"expression\":\"85 * 0.2\"}");
        verify(callbacks).onToolResult("calculator", "85 * 0.2 = 17", true);
        verify(callbacks).onResponse("20% of 85 is 17.");
    }

    @Test
    void shouldAdvertiseOnlyTheToolOfSingleIntent() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("20% of 85 is 17."));

        orchestrator.run(PERCENT_QUESTION, callbacks);

        assertEquals(List.of("calculator"), advertisedTools().get(0));
    }

    @Test
    void shouldAdvertiseNoToolsForConversationalMessage() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("Hi! How can I help?"));

        AgentRunResult result = orchestrator.run("Hello!", callbacks);

        assertEquals("Hi! How can I help?", result.content());
        assertEquals(List.of(), advertisedTools().get(0));
    }

    @Test
    void shouldAdvertiseAllToolsInPriorityOrderOtherwise() {
        when(provider.getMaxTools()).thenReturn(2);
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("Java records are data carriers."));

        orchestrator.run("Explain what Java records are good for", callbacks);

        assertEquals(List.of("calculator", "remember"), advertisedTools().get(0));
    }

    @Test
    void shouldGenerateIdsForToolCallsWithoutOne() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(
                toolCall(null, "calculator", "{\"expression\":\"85 * 0.2\"}"),
                text("It's 17."));

        orchestrator.run(PERCENT_QUESTION, callbacks);

        List<Message> history = orchestrator.getHistory();
        String id = history.get(2).getToolCalls().get(0).getId();
        assertNotNull(id);
        assertTrue(id.startsWith("call_"));
        assertEquals(id, history.get(3).getToolCallId());
    }

    @Test
    void shouldFeedToolErrorBackToModel() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(
                toolCall("call_1", "calculator", "{\"expression\":\"85 *\"}"),
                text("20% of 85 is 17."));

        AgentRunResult result = orchestrator.run(PERCENT_QUESTION, callbacks);

        String toolMessage = orchestrator.getHistory().get(3).getContent();
        assertTrue(toolMessage.contains("\"error\":\"Invalid expression"));
        assertTrue(toolMessage.contains("\"suggestion\""));
        // calculator never succeeded, so the local result wins
        assertEquals("20% of 85 = 17", result.content());
        verify(callbacks).onToolResult(eq("calculator"), anyString(), eq(false));
    }

    @Test
    void shouldNotExecuteMismatchedTool() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(
                toolCall("call_1", "weather", "{}"),
                text("It is 17."));

        AgentRunResult result = orchestrator.run(PERCENT_QUESTION, callbacks);

        assertEquals(0, weatherCalls.get());
        assertTrue(orchestrator.getHistory().get(3).getContent().startsWith("Tool not executed:"));
        assertEquals("20% of 85 = 17", result.content());
    }

    // ===== Short-circuits =====

    @Test
    void shouldRedirectCreativeRequestWithoutModelCall() {
        AgentOrchestrator orchestrator = orchestrator();

        AgentRunResult result = orchestrator.run("Tell me a story", callbacks);

        assertEquals(ToolCallValidator.CREATIVE_REDIRECT, result.content());
        assertEquals(RunOutcome.CREATIVE_REDIRECT, result.outcome());
        assertEquals(0, result.modelCalls());
        verify(provider, never()).streamComplete(anyList(), anyList());
        assertEquals(ToolCallValidator.CREATIVE_REDIRECT, lastMessage(orchestrator).getContent());
    }

    @Test
    void shouldAnswerLocallyWhenCalculatorIsDisabled() {
        properties.getTools().setDisabled(List.of("calculator"));
        AgentOrchestrator orchestrator = orchestrator();

        AgentRunResult result = orchestrator.run(PERCENT_QUESTION, callbacks);

        assertEquals("20% of 85 = 17", result.content());
        assertEquals(RunOutcome.LOCAL_FALLBACK, result.outcome());
        assertEquals(0, result.modelCalls());
        verify(provider, never()).streamComplete(anyList(), anyList());
    }

    @Test
    void shouldFailWithoutProvider() {
        AgentOrchestrator orchestrator = builder().provider(null).build();

        AgentException error = assertThrows(AgentException.class, () -> orchestrator.run("Hello!", callbacks));

        assertEquals(AgentException.Kind.NO_PROVIDER, error.getKind());
        assertTrue(orchestrator.getHistory().isEmpty());
    }

    // ===== Termination =====

    @Test
    void shouldStopAfterThreeIdenticalToolRounds() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList()))
                .thenAnswer(invocation -> toolCall("call_w", "weather", "{\"location\":\"Paris\"}"));

        AgentRunResult result = orchestrator.run(WEATHER_QUESTION, callbacks);

        assertEquals(RunOutcome.LOOP_DETECTED, result.outcome());
        assertEquals(AgentOrchestrator.LOOP_DETECTED_MESSAGE, result.content());
        assertFalse(result.wasAborted());
        assertEquals(3, result.modelCalls());
        assertEquals(3, weatherCalls.get());
        assertEquals(AgentState.LOOP_DETECTED, orchestrator.getState());
        assertEquals(AgentOrchestrator.LOOP_DETECTED_MESSAGE, lastMessage(orchestrator).getContent());
    }

    @Test
    void shouldThrowWhenIterationsAreExhausted() {
        AgentOrchestrator orchestrator = builder().config(new AgentConfig(4, 3, Duration.ZERO)).build();
        AtomicInteger counter = new AtomicInteger();
        when(provider.streamComplete(anyList(), anyList())).thenAnswer(invocation -> toolCall(null, "calculator",
                "{\"expression\":\"" + counter.incrementAndGet() + " + 1\"}"));

        AgentException error = assertThrows(AgentException.class,
                () -> orchestrator.run(PERCENT_QUESTION, callbacks));

        assertEquals(AgentException.Kind.MAX_ITERATIONS_REACHED, error.getKind());
        assertEquals(AgentState.MAX_ITERATIONS_REACHED, orchestrator.getState());
        verify(provider, times(4)).streamComplete(anyList(), anyList());
        verify(callbacks).onError(error);
    }

    @Test
    void shouldReplaceBlankAnswer() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList()))
                .thenReturn(Flux.just(StreamChunk.text("null"), StreamChunk.completed()));

        AgentRunResult result = orchestrator.run("Hello!", callbacks);

        assertEquals(AgentOrchestrator.EMPTY_RESPONSE_MESSAGE, result.content());
    }

    @Test
    void shouldReplaceRefusal() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("I'm unable to help with that."));

        AgentRunResult result = orchestrator.run("Explain what Java records are good for", callbacks);

        assertEquals(ToolCallValidator.REFUSAL_FALLBACK, result.content());
    }

    // ===== Retries =====

    @Test
    void shouldRetryTransientFailure() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(
                Flux.error(new SocketTimeoutException("read timed out")),
                text("Hi there!"));

        AgentRunResult result = orchestrator.run("Hello!", callbacks);

        assertEquals("Hi there!", result.content());
        assertEquals(1, result.modelCalls());
        verify(provider, times(2)).streamComplete(anyList(), anyList());
    }

    @Test
    void shouldGiveUpAfterMaxRetries() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList()))
                .thenAnswer(invocation -> Flux.error(new IllegalStateException("Rate limit exceeded")));

        IllegalStateException error = assertThrows(IllegalStateException.class,
                () -> orchestrator.run("Hello!", callbacks));

        assertEquals("Rate limit exceeded", error.getMessage());
        verify(provider, times(3)).streamComplete(anyList(), anyList());
        verify(callbacks).onError(error);
    }

    @Test
    void shouldNotRetryPermanentFailure() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList()))
                .thenReturn(Flux.error(new IllegalStateException("Invalid API key")));

        assertThrows(IllegalStateException.class, () -> orchestrator.run("Hello!", callbacks));

        verify(provider, times(1)).streamComplete(anyList(), anyList());
    }

    @Test
    void shouldRecoverFromContextOverflowWithAggressiveTrim() {
        AgentOrchestrator orchestrator = builder().config(new AgentConfig(10, 1, Duration.ZERO)).build();
        orchestrator.loadMessages(List.of(
                Message.user("Plan my trip to Rome"), Message.assistant("Sure, when?"),
                Message.user("In May"), Message.assistant("Noted, May it is.")));
        when(provider.streamComplete(anyList(), anyList())).thenReturn(
                Flux.error(new IllegalStateException("This model's maximum context length is 4096 tokens")),
                text("Hi again!"));

        AgentRunResult result = orchestrator.run("Hello!", callbacks);

        assertEquals("Hi again!", result.content());
        verify(provider).resetSession();
        verify(summarizer).summarize(anyString());

        List<Message> history = orchestrator.getHistory();
        assertEquals(List.of("system", "assistant", "user", "assistant"),
                history.stream().map(Message::getRole).toList());
        assertEquals("Noted, May it is.", history.get(1).getContent());
    }

    @Test
    void shouldRecoverFromContextOverflowOnlyOnce() {
        AgentOrchestrator orchestrator = builder().config(new AgentConfig(10, 1, Duration.ZERO)).build();
        when(provider.streamComplete(anyList(), anyList()))
                .thenAnswer(invocation -> Flux.error(new IllegalStateException("prompt is too long")));

        assertThrows(IllegalStateException.class, () -> orchestrator.run("Hello!", callbacks));

        verify(provider, times(2)).streamComplete(anyList(), anyList());
    }

    // ===== Cancellation =====

    @Test
    void shouldAbortRunWhenCancelledDuringStreaming() {
        AgentOrchestrator orchestrator = orchestrator();
        doAnswer(invocation -> {
            orchestrator.cancel();
            return null;
        }).when(callbacks).onStreamChunk(anyString());
        when(provider.streamComplete(anyList(), anyList())).thenReturn(
                Flux.just(StreamChunk.text("Hel"), StreamChunk.text("lo"), StreamChunk.completed()));

        assertThrows(CancellationException.class, () -> orchestrator.run("Hello!", callbacks));

        assertEquals(AgentState.IDLE, orchestrator.getState());
        verify(callbacks, never()).onResponse(anyString());
        verify(callbacks, never()).onError(any());
    }

    @Test
    void shouldRunAgainAfterCancellation() {
        AgentOrchestrator orchestrator = orchestrator();
        orchestrator.cancel();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("Hi!"));

        AgentRunResult result = orchestrator.run("Hello!", callbacks);

        assertEquals("Hi!", result.content());
    }

    @Test
    void shouldDiscardToolResultWhenCancelledDuringTool() {
        AgentOrchestrator orchestrator = orchestrator();
        doAnswer(invocation -> {
            orchestrator.cancel();
            return null;
        }).when(callbacks).onToolCall(anyString(), anyString());
        when(provider.streamComplete(anyList(), anyList())).thenReturn(
                toolCall("call_1", "calculator", "{\"expression\":\"85 * 0.2\"}"),
                text("never reached"));

        assertThrows(CancellationException.class, () -> orchestrator.run(PERCENT_QUESTION, callbacks));

        assertTrue(orchestrator.getHistory().stream().noneMatch(Message::isToolMessage));
        verify(provider, times(1)).streamComplete(anyList(), anyList());
    }

    // ===== Native tool backends =====

    @Test
    void shouldRecordNativeToolExecutions() {
        when(provider.handlesToolsNatively()).thenReturn(true);
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(Flux.just(
                StreamChunk.toolExecutions(List.of(
                        new ToolExecution("weather", "{\"location\":\"Paris\"}", "Paris: Sunny, 24°C", true))),
                StreamChunk.text("It's sunny in Paris, 24°C."),
                StreamChunk.completed()));

        AgentRunResult result = orchestrator.run(WEATHER_QUESTION, callbacks);

        assertEquals("It's sunny in Paris, 24°C.", result.content());
        assertEquals(1, result.modelCalls());
        assertEquals(0, weatherCalls.get());
        Message toolMessage = orchestrator.getHistory().get(2);
        assertTrue(toolMessage.isToolMessage());
        assertEquals("weather", toolMessage.getToolName());
        assertEquals("Paris: Sunny, 24°C", toolMessage.getContent());
        verify(callbacks).onToolResult("weather", "Paris: Sunny, 24°C", true);
    }

    // ===== Prompt and history =====

    @Test
    void shouldTrimHistoryAndInjectSummaryOnNextRun() {
        AgentOrchestrator orchestrator = builder()
                .trimmer(new HistoryTrimmer(summarizer, Runnable::run, 100, 0.8, Duration.ofSeconds(1)))
                .build();
        List<Message> saved = new ArrayList<>();
        for (int i = 0; i < 6; i++) {
            String text = "message " + i + " " + "x".repeat(70);
            saved.add(i % 2 == 0 ? Message.user(text) : Message.assistant(text));
        }
        orchestrator.loadMessages(saved);
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("Hi!"), text("Hello again!"));

        orchestrator.run("Hello!", callbacks);

        ContextStats stats = orchestrator.getContextStats();
        assertEquals(2, stats.trimmedCount());
        assertTrue(orchestrator.getHistory().stream().noneMatch(m -> m.getContent().startsWith("message 0 ")));
        verify(summarizer).summarize(anyString());

        orchestrator.run("Hey!", callbacks);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> captor = ArgumentCaptor.forClass(List.class);
        verify(provider, times(2)).streamComplete(captor.capture(), anyList());
        String systemPrompt = captor.getAllValues().get(1).get(0).getContent();
        assertTrue(systemPrompt.contains("CONVERSATION SUMMARY:\n" + SUMMARY));
    }

    @Test
    void shouldInjectRelevantMemories() {
        MemoryComponent memory = mock(MemoryComponent.class);
        when(memory.getRelevantForConversation(anyList()))
                .thenReturn(Optional.of("USER FACTS:\n- Lives in Paris"));
        AgentOrchestrator orchestrator = builder().memory(memory).build();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("It's sunny."));

        orchestrator.run(WEATHER_QUESTION, callbacks);

        verify(memory).getRelevantForConversation(List.of("weather", "paris"));
        assertTrue(orchestrator.getHistory().get(0).getContent().contains("CONTEXT:\nUSER FACTS:\n- Lives in Paris"));
    }

    @Test
    void shouldApplyTemplateFocusAndTools() {
        AgentOrchestrator orchestrator = orchestrator();
        orchestrator.setTemplate(new TemplateCatalog().findById("research_mode").orElseThrow());
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("Records are immutable carriers."));

        orchestrator.run("Explain what Java records are good for", callbacks);

        assertEquals(List.of("remember"), advertisedTools().get(0));
        assertTrue(orchestrator.getHistory().get(0).getContent().contains("FOCUS: Help with research."));
        assertEquals("research_mode", orchestrator.getTemplate().orElseThrow().getId());
    }

    @Test
    void shouldKeepSingleSystemMessageAcrossRuns() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("Hi!"), text("Bye!"));

        orchestrator.run("Hello!", callbacks);
        orchestrator.run("Thanks, bye", callbacks);

        List<Message> history = orchestrator.getHistory();
        assertEquals(5, history.size());
        assertEquals(1, history.stream().filter(Message::isSystemMessage).count());
        assertTrue(history.get(0).isSystemMessage());
    }

    @Test
    void shouldForwardAttachmentWithUserMessage() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("It looks like a receipt."));
        Attachment photo = Attachment.builder()
                .type(Attachment.Type.IMAGE)
                .data(new byte[] { 7, 8, 9 })
                .mimeType("image/png")
                .build();

        orchestrator.run("What is in this photo?", photo, callbacks);

        Message user = orchestrator.getHistory().get(1);
        assertTrue(user.hasAttachment());
        assertSame(photo, user.getAttachment());

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> sent = ArgumentCaptor.forClass(List.class);
        verify(provider).streamComplete(sent.capture(), anyList());
        assertSame(photo, sent.getValue().get(1).getAttachment());
        assertFalse(orchestrator.getHistory().get(2).hasAttachment());
    }

    @Test
    void shouldReportContextStats() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("a".repeat(40)));

        orchestrator.run("u".repeat(20), callbacks);

        ContextStats stats = orchestrator.getContextStats();
        assertEquals(5, stats.userTokens());
        assertEquals(10, stats.assistantTokens());
        assertEquals(15, stats.currentTokens());
        assertEquals(1000, stats.maxTokens());
        assertEquals(3, stats.messageCount());
        assertTrue(stats.systemTokens() > 0);
        assertFalse(stats.isNearLimit());
    }

    @Test
    void shouldResetHistoryButKeepSystemMessage() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("Hi!"));
        orchestrator.run("Hello!", callbacks);

        orchestrator.reset();

        assertEquals(1, orchestrator.getHistory().size());
        assertTrue(orchestrator.getHistory().get(0).isSystemMessage());
        assertTrue(orchestrator.getMessagesForSave().isEmpty());
        assertEquals(AgentState.IDLE, orchestrator.getState());
        verify(provider, never()).resetSession();

        orchestrator.resetForNewConversation();

        verify(provider).resetSession();
    }

    @Test
    void shouldLoadSavedMessagesBelowSystemMessage() {
        AgentOrchestrator orchestrator = orchestrator();
        when(provider.streamComplete(anyList(), anyList())).thenReturn(text("Hi!"));
        orchestrator.run("Hello!", callbacks);

        orchestrator.loadMessages(List.of(Message.system("ignored"), Message.user("saved question"),
                Message.assistant("saved answer")));

        List<Message> history = orchestrator.getHistory();
        assertEquals(3, history.size());
        assertNotEquals("ignored", history.get(0).getContent());
        assertEquals(List.of("saved question", "saved answer"),
                orchestrator.getMessagesForSave().stream().map(Message::getContent).toList());
    }

    @Test
    void shouldExtractTopicsWithoutStopWords() {
        assertEquals(List.of("weather", "like", "paris", "weekend"),
                AgentOrchestrator.extractTopics("What's the weather like in Paris this weekend?"));
        assertTrue(AgentOrchestrator.extractTopics(null).isEmpty());
    }

    // ===== Helpers =====

    private AgentOrchestrator orchestrator() {
        return builder().build();
    }

    private AgentOrchestrator.AgentOrchestratorBuilder builder() {
        ObjectMapper objectMapper = new ObjectMapper();
        ToolRegistry toolRegistry = new ToolRegistry(
                List.of(new CalculatorTool(), weatherTool(), stubTool("remember", ToolPriority.IMPORTANT)),
                properties, objectMapper);
        return AgentOrchestrator.builder()
                .provider(provider)
                .toolRegistry(toolRegistry)
                .validator(new ToolCallValidator())
                .errorFormatter(new ToolErrorFormatter(objectMapper))
                .promptBuilder(new SystemPromptBuilder(properties))
                .trimmer(new HistoryTrimmer(summarizer, Runnable::run, 1000, 0.8, Duration.ofSeconds(1)))
                .proactiveContext(new ProactiveContextService(toolRegistry, new TemplateCatalog(), properties,
                        Runnable::run, objectMapper))
                .retryPolicy(new RetryPolicy(() -> 0.0))
                .config(new AgentConfig(10, 3, Duration.ZERO))
                .loopDetectionWindow(3);
    }

    private ToolComponent weatherTool() {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple("weather", "Get the weather");
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                weatherCalls.incrementAndGet();
                return CompletableFuture.completedFuture(ToolResult.success("Paris: Sunny, 24°C"));
            }

            @Override
            public ToolPriority getPriority() {
                return ToolPriority.IMPORTANT;
            }
        };
    }

    private static ToolComponent stubTool(String name, ToolPriority priority) {
        return new ToolComponent() {
            @Override
            public ToolDefinition getDefinition() {
                return ToolDefinition.simple(name, name);
            }

            @Override
            public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
                return CompletableFuture.completedFuture(ToolResult.success("ok"));
            }

            @Override
            public ToolPriority getPriority() {
                return priority;
            }
        };
    }

    private List<List<String>> advertisedTools() {
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<ToolDefinition>> captor = ArgumentCaptor.forClass(List.class);
        verify(provider, atLeastOnce()).streamComplete(anyList(), captor.capture());
        return captor.getAllValues().stream()
                .map(tools -> tools.stream().map(ToolDefinition::getName).toList())
                .toList();
    }

    private static Message lastMessage(AgentOrchestrator orchestrator) {
        List<Message> history = orchestrator.getHistory();
        return history.get(history.size() - 1);
    }

    private static Flux<StreamChunk> text(String content) {
        return Flux.just(StreamChunk.text(content), StreamChunk.completed());
    }

    private static Flux<StreamChunk> toolCall(String id, String name, String arguments) {
        return Flux.just(StreamChunk.toolCalls(List.of(new Message.ToolCall(id, name, arguments))),
                StreamChunk.completed());
    }
}
