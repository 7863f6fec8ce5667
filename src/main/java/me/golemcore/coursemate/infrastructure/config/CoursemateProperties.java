package me.golemcore.coursemate.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All settings live under the {@code coursemate.*} prefix:
 * <ul>
 * <li>{@link LlmProperties} - LLM provider and generation parameters</li>
 * <li>{@link ToolLoopProperties} - round budget and tool output limits</li>
 * <li>{@link SessionProperties} - conversation memory</li>
 * <li>{@link RetrievalProperties} - course retrieval service endpoint</li>
 * <li>{@link HttpProperties} - shared OkHttp client</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "coursemate")
@Data
public class CoursemateProperties {

    private LlmProperties llm = new LlmProperties();
    private ToolLoopProperties toolLoop = new ToolLoopProperties();
    private SessionProperties session = new SessionProperties();
    private RetrievalProperties retrieval = new RetrievalProperties();
    private HttpProperties http = new HttpProperties();

    // ==================== LLM ====================

    @Data
    public static class LlmProperties {
        /** anthropic or openai (any OpenAI-compatible endpoint). */
        private String provider = "anthropic";
        private String apiKey;
        private String baseUrl;
        private String model = "claude-sonnet-4-20250514";
        private double temperature = 0.0;
        private int maxTokens = 800;
        private long timeoutMs = 60000;
    }

    // ==================== TOOL LOOP ====================

    @Data
    public static class ToolLoopProperties {
        /** Tool-enabled LLM calls per query before the forced final call. */
        private int maxRounds = 2;

        /** Tool output beyond this length is truncated before it reaches the model. */
        private int maxToolResultChars = 100000;
    }

    // ==================== SESSIONS ====================

    @Data
    public static class SessionProperties {
        /** Exchanges kept per session, oldest evicted first. */
        private int historyCapacity = 2;
    }

    // ==================== RETRIEVAL ====================

    @Data
    public static class RetrievalProperties {
        private String url = "http://localhost:9621";
        private String apiKey = "";
        private int timeoutSeconds = 10;
        private int maxResults = 5;
        /** Outline cache entries kept, least recently used evicted first. */
        private int outlineCacheSize = 64;
    }

    // ==================== HTTP ====================

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }
}
