package me.golemcore.assistant.adapter.outbound.llm;

import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.StreamChunk;
import me.golemcore.assistant.infrastructure.config.AssistantProperties;
import me.golemcore.assistant.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class LlmConversationSummarizerTest {

    private static final String TRANSCRIPT = "user: I am planning a trip to Paris\nassistant: Sounds great!";

    private LlmPort llmPort;
    private AssistantProperties properties;
    private LlmConversationSummarizer summarizer;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        when(llmPort.isAvailable()).thenReturn(true);
        properties = new AssistantProperties();
        summarizer = new LlmConversationSummarizer(llmPort, properties, Clock.systemUTC());
    }

    @Test
    void shouldJoinStreamedSummary() {
        when(llmPort.streamComplete(anyList(), anyList())).thenReturn(Flux.just(
                StreamChunk.text(" User plans a trip"),
                StreamChunk.text(" to Paris. "),
                StreamChunk.completed()));

        Optional<String> summary = summarizer.summarize(TRANSCRIPT).join();

        assertEquals(Optional.of("User plans a trip to Paris."), summary);

        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<Message>> messages = ArgumentCaptor.forClass(List.class);
        verify(llmPort).streamComplete(messages.capture(), eq(List.of()));
        assertEquals(2, messages.getValue().size());
        assertTrue(messages.getValue().get(0).getContent().contains("at most 112 words"));
        assertEquals(TRANSCRIPT, messages.getValue().get(1).getContent());
    }

    @Test
    void shouldSkipBlankTranscript() {
        assertEquals(Optional.empty(), summarizer.summarize("  ").join());
        verify(llmPort, never()).streamComplete(anyList(), anyList());
    }

    @Test
    void shouldReturnEmptyWhenModelUnavailable() {
        when(llmPort.isAvailable()).thenReturn(false);

        assertEquals(Optional.empty(), summarizer.summarize(TRANSCRIPT).join());
        verify(llmPort, never()).streamComplete(anyList(), anyList());
    }

    @Test
    void shouldReturnEmptyForBlankAnswer() {
        when(llmPort.streamComplete(anyList(), anyList()))
                .thenReturn(Flux.just(StreamChunk.text("   "), StreamChunk.completed()));

        assertEquals(Optional.empty(), summarizer.summarize(TRANSCRIPT).join());
    }

    @Test
    void shouldReturnEmptyOnModelError() {
        when(llmPort.streamComplete(anyList(), anyList()))
                .thenReturn(Flux.error(new IllegalStateException("Rate limit exceeded")));

        assertEquals(Optional.empty(), summarizer.summarize(TRANSCRIPT).join());
    }

    @Test
    void shouldReturnEmptyOnTimeout() {
        properties.getSummary().setTimeoutMs(50);
        summarizer = new LlmConversationSummarizer(llmPort, properties, Clock.systemUTC());
        when(llmPort.streamComplete(anyList(), anyList())).thenReturn(Flux.never());

        assertEquals(Optional.empty(), summarizer.summarize(TRANSCRIPT).join());
    }
}
