package me.golemcore.coursemate.domain.model;

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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * A single message exchanged with the LLM during one query run. Content is an
 * ordered list of {@link Segment}s: plain text, tool invocations requested by
 * the model, and tool outcomes sent back to it.
 *
 * <p>
 * Only two roles exist: {@code user} and {@code assistant}. Tool outcomes
 * travel inside a user message, one segment per invocation.
 */
@Data
@Builder
public class Message {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    private String role;

    @Builder.Default
    private List<Segment> segments = new ArrayList<>();

    private Instant timestamp;

    /**
     * Creates a user message holding a single text segment. The timestamp is
     * left to the caller's clock.
     */
    public static Message user(String text) {
        return Message.builder()
                .role(ROLE_USER)
                .segments(new ArrayList<>(List.of(Segment.text(text))))
                .build();
    }

    /**
     * Concatenated text of all TEXT segments, or {@code null} when there are none.
     */
    public String getText() {
        if (segments == null) {
            return null;
        }
        List<String> texts = segments.stream()
                .filter(s -> s.getType() == Segment.Type.TEXT)
                .map(Segment::getText)
                .toList();
        return texts.isEmpty() ? null : String.join("\n", texts);
    }

    /**
     * Tool invocations in the order the model listed them.
     */
    public List<ToolCall> getToolCalls() {
        if (segments == null) {
            return List.of();
        }
        return segments.stream()
                .filter(s -> s.getType() == Segment.Type.TOOL_INVOCATION)
                .map(s -> ToolCall.builder()
                        .id(s.getToolCallId())
                        .name(s.getToolName())
                        .arguments(s.getArguments())
                        .build())
                .collect(Collectors.toList());
    }

    public boolean hasToolCalls() {
        return segments != null && segments.stream().anyMatch(s -> s.getType() == Segment.Type.TOOL_INVOCATION);
    }

    /**
     * Tool outcome segments carried by this message.
     */
    public List<Segment> getToolOutcomes() {
        if (segments == null) {
            return List.of();
        }
        return segments.stream()
                .filter(s -> s.getType() == Segment.Type.TOOL_OUTCOME)
                .toList();
    }

    /**
     * One piece of message content. Which fields are set depends on
     * {@link #getType()}.
     */
    @Data
    @Builder
    public static class Segment {

        public enum Type {
            TEXT, TOOL_INVOCATION, TOOL_OUTCOME
        }

        private Type type;
        private String text;
        private String toolCallId;
        private String toolName;
        private Map<String, Object> arguments;

        public static Segment text(String text) {
            return Segment.builder()
                    .type(Type.TEXT)
                    .text(text)
                    .build();
        }

        public static Segment toolInvocation(ToolCall toolCall) {
            return Segment.builder()
                    .type(Type.TOOL_INVOCATION)
                    .toolCallId(toolCall.getId())
                    .toolName(toolCall.getName())
                    .arguments(toolCall.getArguments())
                    .build();
        }

        public static Segment toolOutcome(String toolCallId, String toolName, String text) {
            return Segment.builder()
                    .type(Type.TOOL_OUTCOME)
                    .toolCallId(toolCallId)
                    .toolName(toolName)
                    .text(text)
                    .build();
        }
    }

    /**
     * A function call requested by the LLM. The id correlates the call with its
     * outcome segment.
     */
    @Data
    @Builder
    public static class ToolCall {
        private String id;
        private String name;
        private Map<String, Object> arguments;
    }
}
