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


package me.golemcore.assistant.domain.loop;

import lombok.Builder;
import me.golemcore.assistant.domain.component.MemoryComponent;
import me.golemcore.assistant.domain.model.AgentConfig;
import me.golemcore.assistant.domain.model.AgentException;
import me.golemcore.assistant.domain.model.AgentRunResult;
import me.golemcore.assistant.domain.model.AgentRunResult.RunOutcome;
import me.golemcore.assistant.domain.model.AgentState;
import me.golemcore.assistant.domain.model.Attachment;
import me.golemcore.assistant.domain.model.ContextStats;
import me.golemcore.assistant.domain.model.ConversationTemplate;
import me.golemcore.assistant.domain.model.Message;
import me.golemcore.assistant.domain.model.StreamChunk;
import me.golemcore.assistant.domain.model.ToolCallOutcome;
import me.golemcore.assistant.domain.model.ToolDefinition;
import me.golemcore.assistant.domain.model.ToolExecution;
import me.golemcore.assistant.domain.model.ToolExecutionException;
import me.golemcore.assistant.domain.service.HistoryTrimmer;
import me.golemcore.assistant.domain.service.ProactiveContextService;
import me.golemcore.assistant.domain.service.SystemPromptBuilder;
import me.golemcore.assistant.domain.service.TokenEstimator;
import me.golemcore.assistant.domain.service.ToolCallValidator;
import me.golemcore.assistant.domain.service.ToolErrorFormatter;
import me.golemcore.assistant.domain.service.ToolRegistry;
import me.golemcore.assistant.domain.system.LlmErrorClassifier;
import me.golemcore.assistant.domain.system.RetryPolicy;
import me.golemcore.assistant.port.outbound.LlmPort;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Sinks;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Drives one conversation through bounded reason-act-observe runs.
 *
 * <p>
 * A run builds the system prompt, appends the user message, trims history,
 * picks the tools to advertise, then alternates model calls and tool
 * executions until the model answers in plain text. The loop ends early on
 * three identical consecutive tool-call rounds and fails after
 * {@link AgentConfig#maxIterations()} model calls.
 *
 * <p>
 * One instance owns one conversation. Runs and lifecycle operations are
 * serialized by a lock; only {@link #cancel()} may be called concurrently.
 */
public class AgentOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(AgentOrchestrator.class);

    static final String LOOP_DETECTED_MESSAGE = "I seem to be stuck repeating the same step, so I stopped. "
            + "Could you rephrase your request or give me a bit more detail?";
    static final String EMPTY_RESPONSE_MESSAGE = "Sorry, I couldn't come up with a response. Please try again.";

    private static final int PREVIEW_CHARS = 50;
    private static final int MIN_TOPIC_LENGTH = 4;
    private static final Set<String> STOP_WORDS = Set.of(
            "what", "when", "where", "which", "with", "this", "that", "there", "their", "about", "would",
            "could", "should", "please", "have", "from", "your", "tell", "show", "give", "make", "does");

    private final LlmPort provider;
    private final ToolRegistry toolRegistry;
    private final ToolCallValidator validator;
    private final ToolErrorFormatter errorFormatter;
    private final SystemPromptBuilder promptBuilder;
    private final HistoryTrimmer trimmer;
    private final MemoryComponent memory;
    private final ProactiveContextService proactiveContext;
    private final RetryPolicy retryPolicy;
    private final AgentConfig config;
    private final int loopDetectionWindow;

    private final ReentrantLock lock = new ReentrantLock();
    private final List<Message> messages = new ArrayList<>();
    private volatile AgentState state = AgentState.IDLE;
    private volatile boolean cancelRequested;
    private volatile Sinks.One<Boolean> cancelSignal = Sinks.one();
    private ConversationTemplate template;
    private boolean templatePrefetched;

    @Builder
    public AgentOrchestrator(LlmPort provider, ToolRegistry toolRegistry, ToolCallValidator validator,
            ToolErrorFormatter errorFormatter, SystemPromptBuilder promptBuilder, HistoryTrimmer trimmer,
            MemoryComponent memory, ProactiveContextService proactiveContext, RetryPolicy retryPolicy,
            AgentConfig config, Integer loopDetectionWindow) {
        this.provider = provider;
        this.toolRegistry = toolRegistry;
        this.validator = validator;
        this.errorFormatter = errorFormatter;
        this.promptBuilder = promptBuilder;
        this.trimmer = trimmer;
        this.memory = memory;
        this.proactiveContext = proactiveContext;
        this.retryPolicy = retryPolicy != null ? retryPolicy : new RetryPolicy();
        this.config = config != null ? config : AgentConfig.defaults();
        this.loopDetectionWindow = loopDetectionWindow != null ? loopDetectionWindow : 3;
    }

    /**
     * Runs one user turn to completion.
     *
     * @throws AgentException
     *             when no provider is configured or the iteration bound is
     *             exhausted
     * @throws CancellationException
     *             when {@link #cancel()} was called during the run
     */
    public AgentRunResult run(String userText, AgentCallbacks callbacks) {
        return run(userText, null, callbacks);
    }

    /**
     * Runs one turn for a user message with an optional attachment. The
     * attachment is stored on the user message and forwarded to the model.
     */
    public AgentRunResult run(String userText, Attachment attachment, AgentCallbacks callbacks) {
        if (provider == null) {
            log.error("[Agent] No provider configured");
            throw AgentException.noProvider();
        }
        AgentCallbacks observer = callbacks != null ? callbacks : AgentCallbacks.NONE;
        lock.lock();
        try {
            cancelRequested = false;
            cancelSignal = Sinks.one();
            log.info("[Agent] Starting run with message: {}...", preview(userText));
            return doRun(userText, attachment, observer);
        } catch (CancellationException e) {
            log.info("[Agent] Run cancelled");
            state = AgentState.IDLE;
            throw e;
        } catch (RuntimeException e) {
            notify(() -> observer.onError(e));
            throw e;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Requests cancellation of the current run. The model stream is cut
     * immediately; a running tool finishes but its result is discarded.
     */
    public void cancel() {
        cancelRequested = true;
        cancelSignal.tryEmitValue(Boolean.TRUE);
    }

    private AgentRunResult doRun(String userText, Attachment attachment, AgentCallbacks callbacks) {
        RunState run = new RunState();

        state = AgentState.PREPARING_PROMPT;
        String systemPrompt = buildSystemPrompt(userText);
        if (messages.isEmpty() || !messages.get(0).isSystemMessage()) {
            messages.add(0, Message.system(systemPrompt));
        } else {
            messages.set(0, Message.system(systemPrompt));
        }
        checkCancelled();

        messages.add(Message.user(userText, attachment));
        state = AgentState.TRIMMING;
        trimmer.trim(messages);

        state = AgentState.SELECTING_TOOLS;
        if (validator.isCreativeWriting(userText)) {
            log.info("[Agent] Creative writing request intercepted");
            return finish(ToolCallValidator.CREATIVE_REDIRECT, RunOutcome.CREATIVE_REDIRECT, run, callbacks);
        }
        ToolSelection selection = selectTools(userText);
        if (selection.localAnswer().isPresent()) {
            return finish(selection.localAnswer().get(), RunOutcome.LOCAL_FALLBACK, run, callbacks);
        }
        List<ToolDefinition> tools = selection.tools();
        log.debug("[Agent] Advertising tools: {}", tools.stream().map(ToolDefinition::getName).toList());

        for (int iteration = 0; iteration < config.maxIterations(); iteration++) {
            state = AgentState.STREAMING;
            notify(callbacks::onThinking);
            ModelTurn turn = streamWithRetry(tools, run, callbacks);
            run.modelCalls++;

            if (provider.handlesToolsNatively()) {
                return finishNative(userText, turn, run, callbacks);
            }

            if (!turn.toolCalls().isEmpty()) {
                state = AgentState.HANDLING_TOOL_CALLS;
                List<Message.ToolCall> calls = withIds(turn.toolCalls());
                messages.add(Message.assistant(turn.content(), calls));
                for (Message.ToolCall call : calls) {
                    checkCancelled();
                    ToolCallOutcome outcome = processToolCall(userText, call, callbacks);
                    messages.add(Message.tool(call.getId(), call.getName(), outcome.content()));
                    if (outcome instanceof ToolCallOutcome.Executed) {
                        run.executedTools.add(call.getName());
                    }
                }
                if (isLooping(run, calls)) {
                    state = AgentState.LOOP_DETECTED;
                    log.warn("[Agent] Loop detected: {} identical tool rounds", loopDetectionWindow);
                    messages.add(Message.assistant(LOOP_DETECTED_MESSAGE));
                    notify(() -> callbacks.onResponse(LOOP_DETECTED_MESSAGE));
                    return new AgentRunResult(LOOP_DETECTED_MESSAGE, RunOutcome.LOOP_DETECTED, false,
                            run.modelCalls);
                }
                continue;
            }

            state = AgentState.VALIDATING;
            String answer = validate(userText, turn.content(), run.executedTools);
            return finish(answer, RunOutcome.COMPLETED, run, callbacks);
        }

        state = AgentState.MAX_ITERATIONS_REACHED;
        log.warn("[Agent] Max iterations ({}) reached", config.maxIterations());
        throw AgentException.maxIterationsReached();
    }

    private AgentRunResult finishNative(String userText, ModelTurn turn, RunState run, AgentCallbacks callbacks) {
        state = AgentState.HANDLING_TOOL_CALLS;
        for (ToolExecution execution : turn.toolExecutions()) {
            messages.add(Message.tool("native-" + UUID.randomUUID(), execution.name(), execution.result()));
            if (execution.success()) {
                run.executedTools.add(execution.name());
            }
            notify(() -> callbacks.onToolResult(execution.name(), execution.result(), execution.success()));
        }
        state = AgentState.VALIDATING;
        String answer = validate(userText, turn.content(), run.executedTools);
        return finish(answer, RunOutcome.COMPLETED, run, callbacks);
    }

    private AgentRunResult finish(String content, RunOutcome outcome, RunState run, AgentCallbacks callbacks) {
        messages.add(Message.assistant(content));
        state = AgentState.DONE;
        notify(() -> callbacks.onResponse(content));
        log.info("[Agent] Run finished: {} after {} model calls", outcome, run.modelCalls);
        return new AgentRunResult(content, outcome, false, run.modelCalls);
    }

    private String validate(String userText, String content, Set<String> executedTools) {
        String answer = validator.checkCoherence(userText, content, executedTools).orElse(content);
        answer = validator.applyRefusalFallback(answer).orElse(answer);
        if (answer == null || answer.isBlank()) {
            return EMPTY_RESPONSE_MESSAGE;
        }
        return answer;
    }

    // ==================== Tool selection ====================

    private ToolSelection selectTools(String userText) {
        if (validator.isConversational(userText)) {
            log.debug("[Agent] Conversational message, no tools advertised");
            return ToolSelection.of(List.of());
        }

        Optional<String> restricted = validator.restrictedToolName(userText);
        if (restricted.isPresent()) {
            String toolName = restricted.get();
            if (toolRegistry.hasTool(toolName) && isAllowedByTemplate(toolName)) {
                log.debug("[Agent] Single intent detected, restricting tools to '{}'", toolName);
                return ToolSelection.of(toolRegistry.getDefinitionsFor(List.of(toolName)));
            }
            log.info("[Agent] Restricted tool '{}' is unavailable", toolName);
            if ("calculator".equals(toolName)) {
                Optional<String> local = validator.attemptMathFallback(userText);
                if (local.isPresent()) {
                    return new ToolSelection(List.of(), local);
                }
            }
            return ToolSelection.of(List.of());
        }

        if (template != null && template.hasToolRestriction()) {
            return ToolSelection.of(toolRegistry.getDefinitionsFor(template.getToolNames()));
        }
        return ToolSelection.of(toolRegistry.getDefinitionsLimited(provider.getMaxTools()));
    }

    private boolean isAllowedByTemplate(String toolName) {
        return template == null || !template.hasToolRestriction() || template.getToolNames().contains(toolName);
    }

    // ==================== Model call ====================

    private ModelTurn streamWithRetry(List<ToolDefinition> tools, RunState run, AgentCallbacks callbacks) {
        int attempt = 0;
        while (true) {
            checkCancelled();
            try {
                return streamOnce(tools, callbacks);
            } catch (CancellationException e) {
                throw e;
            } catch (RuntimeException e) {
                checkCancelled();
                String code = LlmErrorClassifier.classify(e);
                if (LlmErrorClassifier.isAbortCode(code)) {
                    CancellationException cancelled = new CancellationException("Model call aborted");
                    cancelled.initCause(e);
                    throw cancelled;
                }
                if (LlmErrorClassifier.isContextOverflowCode(code) && !run.overflowRecovered) {
                    run.overflowRecovered = true;
                    log.warn("[Agent] Context overflow reported by provider, trimming aggressively");
                    trimmer.aggressiveTrim(messages, provider);
                    continue;
                }
                attempt++;
                if (attempt >= config.maxRetries() || !retryPolicy.isRetryable(e)) {
                    log.error("[Retry] Model call failed after {} attempt(s): {} ({})", attempt, e.getMessage(), code);
                    throw e;
                }
                Duration delay = retryPolicy.delay(attempt - 1, config.baseRetryDelay());
                log.warn("[Retry] Attempt {}/{} failed ({}), retrying in {} ms", attempt, config.maxRetries(),
                        code, delay.toMillis());
                retryPolicy.pause(delay);
            }
        }
    }

    private ModelTurn streamOnce(List<ToolDefinition> tools, AgentCallbacks callbacks) {
        StringBuilder content = new StringBuilder();
        List<Message.ToolCall> toolCalls = new ArrayList<>();
        List<ToolExecution> executions = new ArrayList<>();

        provider.streamComplete(List.copyOf(messages), tools)
                .takeUntilOther(cancelSignal.asMono())
                .doOnNext(chunk -> {
                    checkCancelled();
                    collect(chunk, content, toolCalls, executions, callbacks);
                })
                .blockLast();
        checkCancelled();
        return new ModelTurn(content.toString().trim(), List.copyOf(toolCalls), List.copyOf(executions));
    }

    private void collect(StreamChunk chunk, StringBuilder content, List<Message.ToolCall> toolCalls,
            List<ToolExecution> executions, AgentCallbacks callbacks) {
        // Some backends emit the literal string "null" for an empty delta
        if (chunk.hasContent() && !"null".equals(chunk.getContent())) {
            content.append(chunk.getContent());
            notify(() -> callbacks.onStreamChunk(chunk.getContent()));
        }
        if (chunk.hasToolCalls()) {
            toolCalls.clear();
            toolCalls.addAll(chunk.getToolCalls());
        }
        if (chunk.hasToolExecutions()) {
            executions.addAll(chunk.getToolExecutions());
        }
    }

    // ==================== Tool execution ====================

    private ToolCallOutcome processToolCall(String userText, Message.ToolCall call, AgentCallbacks callbacks) {
        Optional<String> mismatch = validator.detectMismatch(userText, call.getName());
        ToolCallOutcome outcome;
        if (mismatch.isPresent()) {
            outcome = new ToolCallOutcome.Mismatched(call, mismatch.get());
        } else {
            notify(() -> callbacks.onToolCall(call.getName(), call.getArguments()));
            try {
                String result = toolRegistry.execute(call.getName(), call.getArguments());
                outcome = new ToolCallOutcome.Executed(call, result);
            } catch (ToolExecutionException e) {
                log.warn("[Tools] '{}' failed ({}): {}", call.getName(), e.getKind(), e.getMessage());
                outcome = new ToolCallOutcome.Failed(call, e.getKind(), errorFormatter.format(e));
            }
        }
        checkCancelled();
        ToolCallOutcome finalOutcome = outcome;
        notify(() -> callbacks.onToolResult(call.getName(), finalOutcome.content(), finalOutcome.success()));
        return outcome;
    }

    private boolean isLooping(RunState run, List<Message.ToolCall> calls) {
        String signature = calls.stream().map(Message.ToolCall::signature).collect(Collectors.joining("|"));
        run.signatures.addLast(signature);
        while (run.signatures.size() > loopDetectionWindow) {
            run.signatures.removeFirst();
        }
        return run.signatures.size() == loopDetectionWindow
                && run.signatures.stream().distinct().count() == 1;
    }

    private static List<Message.ToolCall> withIds(List<Message.ToolCall> calls) {
        List<Message.ToolCall> result = new ArrayList<>(calls.size());
        for (Message.ToolCall call : calls) {
            String id = call.getId() != null && !call.getId().isBlank()
                    ? call.getId()
                    : "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
            result.add(new Message.ToolCall(id, call.getName(), call.getArguments()));
        }
        return result;
    }

    // ==================== Prompt ====================

    private String buildSystemPrompt(String userText) {
        String proactive = null;
        if (template != null && !templatePrefetched && proactiveContext != null) {
            templatePrefetched = true;
            proactive = proactiveContext.prefetchTemplate(template).orElse(null);
        }
        if (proactive == null && proactiveContext != null) {
            proactive = proactiveContext.buildProactiveContext(userText).orElse(null);
        }

        SystemPromptBuilder.PromptSections sections = SystemPromptBuilder.PromptSections.builder()
                .templateFocus(template != null ? template.getSystemPromptFocus() : null)
                .summary(trimmer.getSummary().orElse(null))
                .memories(memory != null ? memory.getRelevantForConversation(extractTopics(userText)).orElse(null)
                        : null)
                .proactiveContext(proactive)
                .disabledTools(toolRegistry.getDisabledToolDescriptions())
                .build();
        return promptBuilder.build(sections);
    }

    static List<String> extractTopics(String text) {
        if (text == null) {
            return List.of();
        }
        Set<String> topics = new LinkedHashSet<>();
        for (String word : text.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+")) {
            if (word.length() >= MIN_TOPIC_LENGTH && !STOP_WORDS.contains(word)) {
                topics.add(word);
            }
        }
        return List.copyOf(topics);
    }

    // ==================== Lifecycle ====================

    /**
     * Clears the conversation, keeping only the system message.
     */
    public void reset() {
        lock.lock();
        try {
            Message system = !messages.isEmpty() && messages.get(0).isSystemMessage() ? messages.get(0) : null;
            messages.clear();
            if (system != null) {
                messages.add(system);
            }
            trimmer.reset();
            templatePrefetched = false;
            state = AgentState.IDLE;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Clears the conversation and the provider's cached session.
     */
    public void resetForNewConversation() {
        lock.lock();
        try {
            reset();
            if (provider != null) {
                provider.resetSession();
            }
            log.info("[Agent] Reset for new conversation (including provider session)");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces history with saved messages below the current system message.
     */
    public void loadMessages(List<Message> saved) {
        lock.lock();
        try {
            Message system = !messages.isEmpty() && messages.get(0).isSystemMessage() ? messages.get(0) : null;
            messages.clear();
            if (system != null) {
                messages.add(system);
            }
            saved.stream().filter(message -> !message.isSystemMessage()).forEach(messages::add);
        } finally {
            lock.unlock();
        }
    }

    public List<Message> getMessagesForSave() {
        lock.lock();
        try {
            return messages.stream().filter(message -> !message.isSystemMessage()).toList();
        } finally {
            lock.unlock();
        }
    }

    public List<Message> getHistory() {
        lock.lock();
        try {
            return Collections.unmodifiableList(new ArrayList<>(messages));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Activates a template (or clears it with null). Its tools are prefetched on
     * the next run.
     */
    public void setTemplate(ConversationTemplate template) {
        lock.lock();
        try {
            this.template = template;
            this.templatePrefetched = false;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ConversationTemplate> getTemplate() {
        return Optional.ofNullable(template);
    }

    public AgentState getState() {
        return state;
    }

    public ContextStats getContextStats() {
        int maxHistoryTokens = trimmer.getMaxHistoryTokens();
        lock.lock();
        try {
            int systemTokens = 0;
            int userTokens = 0;
            int assistantTokens = 0;
            int toolTokens = 0;
            for (Message message : messages) {
                int tokens = TokenEstimator.estimate(message);
                if (message.isSystemMessage()) {
                    systemTokens += tokens;
                } else if (message.isUserMessage()) {
                    userTokens += tokens;
                } else if (message.isAssistantMessage()) {
                    assistantTokens += tokens;
                } else {
                    toolTokens += tokens;
                }
            }
            int historyTokens = userTokens + assistantTokens + toolTokens;
            double usage = maxHistoryTokens > 0 ? (double) historyTokens / maxHistoryTokens : 0.0;
            return new ContextStats(historyTokens, maxHistoryTokens, Math.min(1.0, usage), systemTokens,
                    userTokens, assistantTokens, toolTokens, messages.size(), trimmer.getTrimmedCount());
        } finally {
            lock.unlock();
        }
    }

    // ==================== Helpers ====================

    private void checkCancelled() {
        if (cancelRequested || Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Run cancelled");
        }
    }

    private static void notify(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException e) {
            log.warn("[Agent] Callback failed: {}", e.getMessage());
        }
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() <= PREVIEW_CHARS ? text : text.substring(0, PREVIEW_CHARS);
    }

    private record ModelTurn(String content, List<Message.ToolCall> toolCalls, List<ToolExecution> toolExecutions) {
    }

    private record ToolSelection(List<ToolDefinition> tools, Optional<String> localAnswer) {
        static ToolSelection of(List<ToolDefinition> tools) {
            return new ToolSelection(tools, Optional.empty());
        }
    }

    private static final class RunState {
        private int modelCalls;
        private boolean overflowRecovered;
        private final Set<String> executedTools = new LinkedHashSet<>();
        private final Deque<String> signatures = new ArrayDeque<>();
    }
}
