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
import me.golemcore.coursemate.domain.model.ConversationSession;
import me.golemcore.coursemate.domain.model.Exchange;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * In-memory conversation memory. Each session keeps the most recent resolved
 * exchanges up to the configured capacity; nothing is persisted.
 *
 * <p>
 * Sessions are created lazily on the first append and removed only by
 * {@link #reset(String)}. Writes to one session are serialized on the session
 * object; reads work on a snapshot.
 */
@Service
@Slf4j
public class ConversationSessionService {

    private final Map<String, ConversationSession> sessions = new ConcurrentHashMap<>();
    private final AtomicLong sessionCounter = new AtomicLong();
    private final CoursemateProperties properties;
    private final Clock clock;

    public ConversationSessionService(CoursemateProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Mints a fresh session id. The session itself appears on first append.
     */
    public String createSession() {
        String id = "session_" + sessionCounter.incrementAndGet();
        log.debug("Created session id: {}", id);
        return id;
    }

    /**
     * Formatted history, oldest exchange first:
     * {@code "User: <q>\nAssistant: <a>"} per exchange, joined by a newline.
     * Empty for null or unknown ids.
     */
    public String getHistory(String sessionId) {
        return getExchanges(sessionId).stream()
                .map(exchange -> "User: " + exchange.question() + "\nAssistant: " + exchange.answer())
                .collect(Collectors.joining("\n"));
    }

    /**
     * Records a resolved exchange, evicting the oldest one beyond capacity.
     */
    public void append(String sessionId, String question, String answer) {
        if (sessionId == null) {
            return;
        }
        ConversationSession session = sessions.computeIfAbsent(sessionId, this::newSession);
        synchronized (session) {
            session.addExchange(new Exchange(question, answer));
            session.setUpdatedAt(clock.instant());
        }
    }

    /**
     * Drops the session and its history.
     */
    public void reset(String sessionId) {
        if (sessionId == null) {
            return;
        }
        if (sessions.remove(sessionId) != null) {
            log.debug("Reset session: {}", sessionId);
        }
    }

    /**
     * Snapshot of the stored exchanges, oldest first.
     */
    public List<Exchange> getExchanges(String sessionId) {
        if (sessionId == null) {
            return List.of();
        }
        ConversationSession session = sessions.get(sessionId);
        if (session == null) {
            return List.of();
        }
        synchronized (session) {
            return session.snapshot();
        }
    }

    private ConversationSession newSession(String sessionId) {
        Instant now = clock.instant();
        return ConversationSession.builder()
                .id(sessionId)
                .capacity(Math.max(1, properties.getSession().getHistoryCapacity()))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }
}
