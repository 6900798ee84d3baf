package me.golemcore.assistant.domain.service;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.domain.loop.AgentFactory;
import me.golemcore.assistant.domain.loop.AgentOrchestrator;
import me.golemcore.assistant.domain.loop.LoggingAgentCallbacks;
import me.golemcore.assistant.domain.model.AgentRunResult;
import me.golemcore.assistant.domain.model.Attachment;
import me.golemcore.assistant.domain.model.ContextStats;
import me.golemcore.assistant.domain.model.ConversationTemplate;
import me.golemcore.assistant.domain.model.Message;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Owns one {@link AgentOrchestrator} per conversation id. Runs block on model
 * and tool calls, so they are moved to the bounded-elastic scheduler; a
 * cancelled run completes with an aborted result instead of an error.
 */
@Service
@Slf4j
public class ConversationService {

    private final AgentFactory agentFactory;
    private final TemplateCatalog templateCatalog;
    private final Map<String, AgentOrchestrator> conversations = new ConcurrentHashMap<>();

    public ConversationService(AgentFactory agentFactory, TemplateCatalog templateCatalog) {
        this.agentFactory = agentFactory;
        this.templateCatalog = templateCatalog;
    }

    /**
     * Returns the id of an existing conversation, or starts a new one. A blank
     * id starts a conversation under a generated id.
     */
    public String openConversation(String requestedId) {
        String id = requestedId != null && !requestedId.isBlank() ? requestedId : UUID.randomUUID().toString();
        conversations.computeIfAbsent(id, key -> {
            log.info("[API] Starting conversation {}", key);
            return agentFactory.create();
        });
        return id;
    }

    public Mono<AgentRunResult> send(String conversationId, String message) {
        return send(conversationId, message, null);
    }

    public Mono<AgentRunResult> send(String conversationId, String message, Attachment attachment) {
        if (message == null || message.isBlank()) {
            return Mono.error(new IllegalArgumentException("Message must not be blank"));
        }
        AgentOrchestrator orchestrator;
        try {
            orchestrator = require(conversationId);
        } catch (IllegalArgumentException e) {
            return Mono.error(e);
        }
        return Mono.fromCallable(() -> orchestrator.run(message, attachment,
                new LoggingAgentCallbacks(conversationId)))
                .subscribeOn(Schedulers.boundedElastic())
                .onErrorResume(CancellationException.class, e -> {
                    log.info("[API] Run in conversation {} was cancelled", conversationId);
                    return Mono.just(AgentRunResult.aborted());
                });
    }

    /**
     * Cancels the active run of a conversation, if any.
     */
    public void cancel(String conversationId) {
        require(conversationId).cancel();
    }

    /**
     * Cancels any active run and drops the conversation with its history.
     */
    public void close(String conversationId) {
        AgentOrchestrator orchestrator = conversationId != null ? conversations.remove(conversationId) : null;
        if (orchestrator == null) {
            throw new IllegalArgumentException("Unknown conversation: " + conversationId);
        }
        orchestrator.cancel();
        log.info("[API] Closed conversation {}", conversationId);
    }

    public int getConversationCount() {
        return conversations.size();
    }

    public void reset(String conversationId) {
        require(conversationId).resetForNewConversation();
    }

    public ContextStats getStats(String conversationId) {
        return require(conversationId).getContextStats();
    }

    public List<Message> getHistory(String conversationId) {
        return require(conversationId).getHistory();
    }

    /**
     * Activates a bundled template for a conversation; a null id clears it.
     *
     * @return the active template, or null when cleared
     */
    public ConversationTemplate applyTemplate(String conversationId, String templateId) {
        AgentOrchestrator orchestrator = require(conversationId);
        if (templateId == null || templateId.isBlank()) {
            orchestrator.setTemplate(null);
            return null;
        }
        ConversationTemplate template = templateCatalog.findById(templateId)
                .orElseThrow(() -> new IllegalArgumentException("Unknown template: " + templateId));
        orchestrator.setTemplate(template);
        log.info("[API] Conversation {} switched to template {}", conversationId, templateId);
        return template;
    }

    public List<ConversationTemplate> getTemplates() {
        return templateCatalog.getAll();
    }

    private AgentOrchestrator require(String conversationId) {
        AgentOrchestrator orchestrator = conversationId != null ? conversations.get(conversationId) : null;
        if (orchestrator == null) {
            throw new IllegalArgumentException("Unknown conversation: " + conversationId);
        }
        return orchestrator;
    }
}
