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
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Bounded conversation history for one session. Holds at most
 * {@code capacity} exchanges, oldest evicted first.
 *
 * <p>
 * Not thread-safe on its own; callers synchronize on the instance.
 */
@Data
@Builder
public class ConversationSession {

    private String id;
    private int capacity;

    @Builder.Default
    private Deque<Exchange> exchanges = new ArrayDeque<>();

    private Instant createdAt;
    private Instant updatedAt;

    public void addExchange(Exchange exchange) {
        exchanges.addLast(exchange);
        while (exchanges.size() > capacity) {
            exchanges.removeFirst();
        }
    }

    public List<Exchange> snapshot() {
        return List.copyOf(exchanges);
    }
}
