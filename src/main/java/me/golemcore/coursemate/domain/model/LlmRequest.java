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

import java.util.ArrayList;
import java.util.List;

/**
 * Request object sent to the LLM provider: model selection, system
 * instruction, conversation messages, offered tools and generation
 * parameters.
 */
@Data
@Builder
public class LlmRequest {

    private String model;
    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    @Builder.Default
    private List<ToolDefinition> tools = new ArrayList<>();

    @Builder.Default
    private ToolChoice toolChoice = ToolChoice.NONE;

    @Builder.Default
    private double temperature = 0.0;

    private Integer maxTokens;

    private String sessionId;

    public boolean hasTools() {
        return tools != null && !tools.isEmpty() && toolChoice != ToolChoice.NONE;
    }

    /**
     * How the model may use the offered tools.
     */
    public enum ToolChoice {
        /** Model decides whether to call a tool. */
        AUTO,
        /** No tools offered; the model must answer directly. */
        NONE
    }
}
