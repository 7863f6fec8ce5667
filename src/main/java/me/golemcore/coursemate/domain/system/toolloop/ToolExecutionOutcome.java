package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.model.Message;

/**
 * Result of one tool invocation as it is fed back to the model. Failed
 * outcomes are produced by the loop itself when execution throws.
 */
public record ToolExecutionOutcome(String toolCallId, String toolName, String content, boolean failed) {

    public static ToolExecutionOutcome success(Message.ToolCall toolCall, String content) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), content, false);
    }

    public static ToolExecutionOutcome failure(Message.ToolCall toolCall, String reason) {
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), reason, true);
    }
}
