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

import java.util.List;

/**
 * Response from the LLM provider. {@link StopReason#TOOL_REQUEST} means the
 * model stopped to have the listed tool calls executed; anything else is a
 * final answer.
 */
@Data
@Builder
public class LlmResponse {

    private String content;
    private List<Message.ToolCall> toolCalls;
    private StopReason stopReason;
    private LlmUsage usage;
    private String model;

    public boolean hasToolCalls() {
        return toolCalls != null && !toolCalls.isEmpty();
    }

    /**
     * True when the model asked for tools. Providers that report the stop reason
     * loosely are covered by also looking at the tool calls.
     */
    public boolean isToolRequest() {
        return stopReason == StopReason.TOOL_REQUEST && hasToolCalls();
    }

    public enum StopReason {
        TOOL_REQUEST, FINAL
    }
}
