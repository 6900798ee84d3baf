package me.golemcore.assistant.domain.model;

/**
 * Result of processing one requested tool call. Every variant becomes a tool
 * result message fed back to the model.
 */
public sealed interface ToolCallOutcome
        permits ToolCallOutcome.Executed, ToolCallOutcome.Failed, ToolCallOutcome.Mismatched {

    Message.ToolCall call();

    /**
     * Text stored in the tool result message.
     */
    String content();

    boolean success();

    default ToolExecution toExecution() {
        return new ToolExecution(call().getName(), call().getArguments(), content(), success());
    }

    record Executed(Message.ToolCall call, String result) implements ToolCallOutcome {
        @Override
        public String content() {
            return result;
        }

        @Override
        public boolean success() {
            return true;
        }
    }

    /**
     * The tool ran (or was looked up) and failed. {@code errorJson} is the
     * {@code {error, suggestion}} payload.
     */
    record Failed(Message.ToolCall call, ToolExecutionException.Kind kind, String errorJson)
            implements ToolCallOutcome {
        @Override
        public String content() {
            return errorJson;
        }

        @Override
        public boolean success() {
            return false;
        }
    }

    /**
     * The tool was not run because it does not fit the user's request.
     */
    record Mismatched(Message.ToolCall call, String reason) implements ToolCallOutcome {
        @Override
        public String content() {
            return "Tool not executed: " + reason
                    + " Reconsider the user's request and choose the appropriate tool.";
        }

        @Override
        public boolean success() {
            return false;
        }
    }
}
