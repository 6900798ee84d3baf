package me.golemcore.assistant.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.assistant.adapter.inbound.web.dto.ChatMessageRequest;
import me.golemcore.assistant.adapter.inbound.web.dto.ChatMessageResponse;
import me.golemcore.assistant.adapter.inbound.web.dto.ContextStatsDto;
import me.golemcore.assistant.adapter.inbound.web.dto.TemplateDto;
import me.golemcore.assistant.adapter.inbound.web.dto.TemplateSelectionRequest;
import me.golemcore.assistant.domain.model.Attachment;
import me.golemcore.assistant.domain.model.ContextStats;
import me.golemcore.assistant.domain.model.ConversationTemplate;
import me.golemcore.assistant.domain.service.ConversationService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Base64;
import java.util.List;

/**
 * Chat endpoints: send a message, cancel or reset a conversation, inspect its
 * context usage and switch conversation templates.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private final ConversationService conversationService;

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatMessageResponse>> chat(@RequestBody ChatMessageRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return Mono.error(new IllegalArgumentException("message is required"));
        }
        Attachment attachment;
        try {
            attachment = toAttachment(request);
        } catch (IllegalArgumentException e) {
            return Mono.error(new IllegalArgumentException("imageBase64 is not valid Base64", e));
        }
        String conversationId = conversationService.openConversation(request.getConversationId());
        return conversationService.send(conversationId, request.getMessage(), attachment)
                .map(result -> ResponseEntity.ok(ChatMessageResponse.builder()
                        .conversationId(conversationId)
                        .content(result.content())
                        .outcome(result.outcome().name())
                        .wasAborted(result.wasAborted())
                        .modelCalls(result.modelCalls())
                        .build()));
    }

    @PostMapping("/chat/{conversationId}/cancel")
    public Mono<ResponseEntity<Void>> cancel(@PathVariable String conversationId) {
        conversationService.cancel(conversationId);
        return Mono.just(ResponseEntity.accepted().build());
    }

    @PostMapping("/chat/{conversationId}/reset")
    public Mono<ResponseEntity<Void>> reset(@PathVariable String conversationId) {
        return Mono.fromRunnable(() -> conversationService.reset(conversationId))
                .subscribeOn(Schedulers.boundedElastic())
                .then(Mono.just(ResponseEntity.noContent().<Void>build()));
    }

    @DeleteMapping("/chat/{conversationId}")
    public Mono<ResponseEntity<Void>> close(@PathVariable String conversationId) {
        conversationService.close(conversationId);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/chat/{conversationId}/stats")
    public Mono<ResponseEntity<ContextStatsDto>> stats(@PathVariable String conversationId) {
        ContextStats stats = conversationService.getStats(conversationId);
        return Mono.just(ResponseEntity.ok(ContextStatsDto.builder()
                .currentTokens(stats.currentTokens())
                .maxTokens(stats.maxTokens())
                .usagePercent(stats.usagePercent())
                .systemTokens(stats.systemTokens())
                .userTokens(stats.userTokens())
                .assistantTokens(stats.assistantTokens())
                .toolTokens(stats.toolTokens())
                .messageCount(stats.messageCount())
                .trimmedCount(stats.trimmedCount())
                .nearLimit(stats.isNearLimit())
                .critical(stats.isCritical())
                .build()));
    }

    @PostMapping("/chat/{conversationId}/template")
    public Mono<ResponseEntity<TemplateDto>> selectTemplate(@PathVariable String conversationId,
            @RequestBody TemplateSelectionRequest request) {
        ConversationTemplate template = conversationService.applyTemplate(conversationId, request.getTemplateId());
        if (template == null) {
            return Mono.just(ResponseEntity.noContent().build());
        }
        return Mono.just(ResponseEntity.ok(toDto(template)));
    }

    @GetMapping("/templates")
    public Mono<ResponseEntity<List<TemplateDto>>> listTemplates() {
        List<TemplateDto> templates = conversationService.getTemplates().stream()
                .map(ChatController::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(templates));
    }

    private static Attachment toAttachment(ChatMessageRequest request) {
        if (request.getImageBase64() == null || request.getImageBase64().isBlank()) {
            return null;
        }
        return Attachment.builder()
                .type(Attachment.Type.IMAGE)
                .data(Base64.getDecoder().decode(request.getImageBase64().trim()))
                .mimeType(request.getImageMimeType() != null ? request.getImageMimeType() : "image/png")
                .build();
    }

    private static TemplateDto toDto(ConversationTemplate template) {
        return TemplateDto.builder()
                .id(template.getId())
                .name(template.getName())
                .description(template.getDescription())
                .toolNames(template.getToolNames())
                .initialPrompt(template.getInitialPrompt())
                .build();
    }
}
