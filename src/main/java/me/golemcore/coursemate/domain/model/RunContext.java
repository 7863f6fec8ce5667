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
 * Mutable state of a single query run. Created per query and discarded when
 * the answer has been produced.
 */
@Data
@Builder
public class RunContext {

    private String sessionId;
    private String systemPrompt;

    @Builder.Default
    private List<Message> messages = new ArrayList<>();

    /** Sources recorded by tools during this run, in recording order. */
    @Builder.Default
    private List<Source> sources = new ArrayList<>();

    private int round;
    private boolean terminated;
    private String lastError;

    private int llmCalls;
    private int toolExecutions;
}
