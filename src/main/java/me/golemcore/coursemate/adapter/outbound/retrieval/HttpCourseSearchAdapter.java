package me.golemcore.coursemate.adapter.outbound.retrieval;

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

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coursemate.domain.exception.RetrievalException;
import me.golemcore.coursemate.domain.model.CourseCatalog;
import me.golemcore.coursemate.domain.model.CourseOutline;
import me.golemcore.coursemate.domain.model.SearchResults;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import me.golemcore.coursemate.port.outbound.CourseSearchPort;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Course retrieval adapter: talks JSON over HTTP to the service that owns the
 * course index (vector search, catalog and outlines).
 *
 * <p>
 * Endpoints:
 * <ul>
 * <li>POST /search - semantic search with optional course and lesson filters
 * <li>POST /outline - course outline for a (partial) title, 404 when unknown
 * <li>GET /catalog - number of courses and their titles
 * </ul>
 *
 * <p>
 * Configuration:
 * <ul>
 * <li>{@code coursemate.retrieval.url} - base URL
 * <li>{@code coursemate.retrieval.api-key} - optional bearer token
 * <li>{@code coursemate.retrieval.timeout-seconds} - HTTP timeout
 * <li>{@code coursemate.retrieval.max-results} - hits per search
 * <li>{@code coursemate.retrieval.outline-cache-size} - outlines kept in memory
 * </ul>
 *
 * <p>
 * Search never throws: failures come back as {@link SearchResults#error()}
 * text the model can read. Outline and catalog failures raise
 * {@link RetrievalException}.
 */
@Component
@Slf4j
public class HttpCourseSearchAdapter implements CourseSearchPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int HTTP_NOT_FOUND = 404;
    private static final TypeReference<Map<String, Object>> MAP_TYPE_REF = new TypeReference<>() {
    };

    private final CoursemateProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Map<String, CourseOutline> outlineCache;

    public HttpCourseSearchAdapter(CoursemateProperties properties, OkHttpClient baseHttpClient,
            ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int cacheSize = Math.max(1, properties.getRetrieval().getOutlineCacheSize());
        this.outlineCache = Collections.synchronizedMap(new LinkedHashMap<>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, CourseOutline> eldest) {
                return size() > cacheSize;
            }
        });

        // Dedicated client with retrieval-specific timeout
        int timeoutSeconds = properties.getRetrieval().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public SearchResults search(String query, String courseName, Integer lessonNumber) {
        try {
            String body = objectMapper.writeValueAsString(new SearchRequest(query, courseName, lessonNumber,
                    properties.getRetrieval().getMaxResults()));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(baseUrl() + "/search")
                    .post(RequestBody.create(body, JSON));
            addApiKeyHeader(requestBuilder);

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    log.warn("[Retrieval] Search failed: HTTP {}", response.code());
                    return SearchResults.failure("Search error: retrieval service returned HTTP " + response.code());
                }
                return parseSearchResponse(responseBody.string());
            }
        } catch (IOException e) {
            log.warn("[Retrieval] Search error: {}", e.getMessage());
            return SearchResults.failure("Search error: " + e.getMessage());
        } catch (IllegalArgumentException e) {
            log.warn("[Retrieval] Malformed search response: {}", e.getMessage());
            return SearchResults.failure("Search error: malformed response from retrieval service");
        }
    }

    @Override
    public Optional<CourseOutline> getCourseOutline(String courseTitle) {
        if (courseTitle == null || courseTitle.isBlank()) {
            return Optional.empty();
        }
        CourseOutline cached = outlineCache.get(courseTitle);
        if (cached != null) {
            return Optional.of(cached);
        }

        try {
            String body = objectMapper.writeValueAsString(new OutlineRequest(courseTitle));
            Request.Builder requestBuilder = new Request.Builder()
                    .url(baseUrl() + "/outline")
                    .post(RequestBody.create(body, JSON));
            addApiKeyHeader(requestBuilder);

            try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                if (response.code() == HTTP_NOT_FOUND) {
                    return Optional.empty();
                }
                ResponseBody responseBody = response.body();
                if (!response.isSuccessful() || responseBody == null) {
                    throw new RetrievalException("Outline lookup failed: HTTP " + response.code());
                }
                CourseOutline outline = objectMapper.readValue(responseBody.string(), CourseOutline.class);
                if (outline.getTitle() == null) {
                    return Optional.empty();
                }
                outlineCache.put(courseTitle, outline);
                outlineCache.put(outline.getTitle(), outline);
                return Optional.of(outline);
            }
        } catch (IOException e) {
            throw new RetrievalException("Outline lookup failed: " + e.getMessage(), e);
        }
    }

    @Override
    public Optional<String> getLessonLink(String courseTitle, int lessonNumber) {
        return getCourseOutline(courseTitle)
                .filter(outline -> outline.getLessons() != null)
                .flatMap(outline -> outline.getLessons().stream()
                        .filter(lesson -> lesson.getNumber() == lessonNumber)
                        .map(CourseOutline.Lesson::getLink)
                        .filter(link -> link != null && !link.isBlank())
                        .findFirst());
    }

    @Override
    public CourseCatalog getCatalog() {
        Request.Builder requestBuilder = new Request.Builder()
                .url(baseUrl() + "/catalog")
                .get();
        addApiKeyHeader(requestBuilder);

        try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new RetrievalException("Catalog request failed: HTTP " + response.code());
            }
            JsonNode node = objectMapper.readTree(responseBody.string());
            List<String> titles = new ArrayList<>();
            node.path("course_titles").forEach(title -> titles.add(title.asText()));
            int total = node.has("total_courses") ? node.get("total_courses").asInt() : titles.size();
            return new CourseCatalog(total, titles);
        } catch (IOException e) {
            throw new RetrievalException("Catalog request failed: " + e.getMessage(), e);
        }
    }

    private SearchResults parseSearchResponse(String responseBody) throws IOException {
        JsonNode node = objectMapper.readTree(responseBody);
        String error = node.hasNonNull("error") ? node.get("error").asText() : null;
        if (error != null && !error.isBlank()) {
            return SearchResults.failure(error);
        }

        List<String> documents = new ArrayList<>();
        node.path("documents").forEach(doc -> documents.add(doc.asText()));

        List<Map<String, Object>> metadata = new ArrayList<>();
        for (JsonNode meta : node.path("metadata")) {
            if (meta.isNull()) {
                metadata.add(Map.of());
                continue;
            }
            if (!meta.isObject()) {
                throw new IllegalArgumentException("metadata entry is not an object: " + meta.getNodeType());
            }
            metadata.add(objectMapper.convertValue(meta, MAP_TYPE_REF));
        }
        return new SearchResults(documents, metadata, null);
    }

    private String baseUrl() {
        String url = properties.getRetrieval().getUrl();
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getRetrieval().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    // Request DTOs
    record SearchRequest(
            String query,
            @JsonProperty("course_name") String courseName,
            @JsonProperty("lesson_number") Integer lessonNumber,
            int limit) {
    }

    record OutlineRequest(@JsonProperty("course_title") String courseTitle) {
    }
}
