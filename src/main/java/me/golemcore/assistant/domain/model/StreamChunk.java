package me.golemcore.assistant.domain.model;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * One element of a model response stream. A chunk carries incremental text,
 * the finalized set of requested tool calls, tool executions reported by a
 * native backend, or the completion marker.
 */
@Data
@Builder
public class StreamChunk {

    private String content;
    private List<Message.ToolCall> toolCalls;
    private List<ToolExecution> toolExecutions;
    private boolean complete;

    public static StreamChunk text(String content) {
        return StreamChunk.builder().content(content).build();
    }

    public static StreamChunk toolCalls(List<Message.ToolCall> toolCalls) {
        return StreamChunk.builder().toolCalls(toolCalls).build();
    }

    public static StreamChunk toolExecutions(List<ToolExecution> toolExecutions) {
        return StreamChunk.builder().toolExecutions(toolExecutions).build();
    }

    public static StreamChunk completed() {
        return StreamChunk.builder().complete(true).build();
    }

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    public boolean hasToolExecutions() {
        return toolExecutions != null && !toolExecutions.isEmpty();
    }
}
