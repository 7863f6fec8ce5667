package me.golemcore.coursemate.domain.system.toolloop;

import me.golemcore.coursemate.domain.model.LlmResponse;
import me.golemcore.coursemate.domain.model.Message;
import me.golemcore.coursemate.domain.model.RunContext;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Default implementation: the assistant turn keeps its text and every
 * invocation in model order; all outcomes of a round go into a single user
 * message.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void appendAssistantToolCalls(RunContext context, LlmResponse llmResponse) {
        List<Message.Segment> segments = new ArrayList<>();
        String text = llmResponse.getContent();
        if (text != null && !text.isBlank()) {
            segments.add(Message.Segment.text(text));
        }
        for (Message.ToolCall toolCall : llmResponse.getToolCalls()) {
            segments.add(Message.Segment.toolInvocation(toolCall));
        }

        context.getMessages().add(Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .segments(segments)
                .timestamp(clock.instant())
                .build());
    }

    @Override
    public void appendToolOutcomes(RunContext context, List<ToolExecutionOutcome> outcomes) {
        List<Message.Segment> segments = new ArrayList<>();
        for (ToolExecutionOutcome outcome : outcomes) {
            segments.add(Message.Segment.toolOutcome(outcome.toolCallId(), outcome.toolName(), outcome.content()));
        }

        context.getMessages().add(Message.builder()
                .role(Message.ROLE_USER)
                .segments(segments)
                .timestamp(clock.instant())
                .build());
    }
}
