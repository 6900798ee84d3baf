package me.golemcore.assistant.adapter.inbound.web.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChatMessageResponse {
    private String conversationId;
    private String content;
    private String outcome;
    private boolean wasAborted;
    private int modelCalls;
}
