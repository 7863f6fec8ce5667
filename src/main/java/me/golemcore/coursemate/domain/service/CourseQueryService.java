package me.golemcore.coursemate.domain.service;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.coursemate.domain.model.Message;
import me.golemcore.coursemate.domain.model.QueryAnswer;
import me.golemcore.coursemate.domain.model.RunContext;
import me.golemcore.coursemate.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.coursemate.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for answering a question: reads session history once, runs the
 * tool loop on a fresh {@link RunContext} and records the resolved exchange.
 */
@Service
@Slf4j
public class CourseQueryService {

    private final ToolLoopSystem toolLoopSystem;
    private final ConversationSessionService sessionService;
    private final CoursemateProperties properties;
    private final Clock clock;

    public CourseQueryService(ToolLoopSystem toolLoopSystem, ConversationSessionService sessionService,
            CoursemateProperties properties, Clock clock) {
        this.toolLoopSystem = toolLoopSystem;
        this.sessionService = sessionService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs a query with the configured round budget.
     */
    public QueryAnswer run(String query, String sessionId) {
        return run(query, sessionId, properties.getToolLoop().getMaxRounds());
    }

    /**
     * Runs a query.
     *
     * @param query
     *            the user's question, must not be blank
     * @param sessionId
     *            session whose history is used and extended, or {@code null}
     * @param maxRounds
     *            tool-enabled LLM calls allowed before the forced final call,
     *            values below 1 count as 1
     * @return the answer with the sources cited by tools during this run
     * @throws IllegalArgumentException
     *             when the query is blank
     */
    public QueryAnswer run(String query, String sessionId, int maxRounds) {
        if (query == null || query.isBlank()) {
            throw new IllegalArgumentException("Query must not be blank");
        }

        String history = sessionService.getHistory(sessionId);

        Message question = Message.user(query);
        question.setTimestamp(clock.instant());
        List<Message> messages = new ArrayList<>();
        messages.add(question);
        RunContext context = RunContext.builder()
                .sessionId(sessionId)
                .systemPrompt(SystemPrompts.withHistory(maxRounds, history))
                .messages(messages)
                .build();

        ToolLoopTurnResult result = toolLoopSystem.processTurn(context, maxRounds);
        String answer = result.answer() != null ? result.answer() : "";
        log.info("Query answered: session={}, llmCalls={}, toolExecutions={}, sources={}",
                sessionId, result.llmCalls(), result.toolExecutions(), context.getSources().size());

        if (sessionId != null) {
            sessionService.append(sessionId, query, answer);
        }
        return new QueryAnswer(answer, context.getSources(), sessionId);
    }
}
