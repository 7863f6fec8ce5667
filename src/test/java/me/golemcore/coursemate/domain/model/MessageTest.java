package me.golemcore.coursemate.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MessageTest {

    @Test
    void shouldExposeSegmentsByType() {
        Message.ToolCall call = Message.ToolCall.builder()
                .id("tc-1").name("get_course_outline").arguments(Map.of("course_title", "MCP")).build();
        Message message = Message.builder()
                .role(Message.ROLE_ASSISTANT)
                .segments(List.of(
                        Message.Segment.text("first"),
                        Message.Segment.toolInvocation(call),
                        Message.Segment.text("second")))
                .build();

        assertEquals(Message.ROLE_ASSISTANT, message.getRole());
        assertTrue(message.hasToolCalls());
        assertEquals("first\nsecond", message.getText());
        assertEquals(List.of(call), message.getToolCalls());
        assertTrue(message.getToolOutcomes().isEmpty());
    }

    @Test
    void shouldReturnNullTextForOutcomeOnlyMessage() {
        Message message = Message.builder()
                .role(Message.ROLE_USER)
                .segments(List.of(Message.Segment.toolOutcome("tc-1", "get_course_outline", "outline")))
                .build();

        assertNull(message.getText());
        assertFalse(message.hasToolCalls());
        assertEquals("outline", message.getToolOutcomes().get(0).getText());
    }

    @Test
    void shouldRequireToolCallsForToolRequest() {
        LlmResponse withoutCalls = LlmResponse.builder()
                .stopReason(LlmResponse.StopReason.TOOL_REQUEST)
                .toolCalls(List.of())
                .build();

        assertFalse(withoutCalls.isToolRequest());
    }
}
