package me.golemcore.coursemate.tools;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coursemate.domain.component.ToolComponent;
import me.golemcore.coursemate.domain.exception.RetrievalException;
import me.golemcore.coursemate.domain.model.SearchResults;
import me.golemcore.coursemate.domain.model.Source;
import me.golemcore.coursemate.domain.model.ToolDefinition;
import me.golemcore.coursemate.port.outbound.CourseSearchPort;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Tool for searching course content.
 *
 * <p>
 * Runs a semantic search through {@link CourseSearchPort}, optionally filtered
 * by course (partial names resolve on the retrieval side) and lesson number.
 * Each hit is rendered with a {@code [<course> - Lesson <n>]} header and cited
 * as a {@link Source} pointing to the lesson link when one is known.
 *
 * <p>
 * Retrieval errors are returned verbatim; an empty result yields a
 * {@code No relevant content found...} sentence naming the filters.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class CourseSearchTool implements ToolComponent {

    public static final String NAME = "search_course_content";

    private static final String PARAM_QUERY = "query";
    private static final String PARAM_COURSE_NAME = "course_name";
    private static final String PARAM_LESSON_NUMBER = "lesson_number";
    private static final String TYPE_STRING = "string";
    private static final String TYPE_INTEGER = "integer";
    private static final String TYPE_OBJECT = "object";

    private static final String META_COURSE_TITLE = "course_title";
    private static final String META_LESSON_NUMBER = "lesson_number";

    private final CourseSearchPort courseSearchPort;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Search course materials with smart course name matching and lesson filtering")
                .inputSchema(Map.of(
                        "type", TYPE_OBJECT,
                        "properties", Map.of(
                                PARAM_QUERY, Map.of(
                                        "type", TYPE_STRING,
                                        "description", "What to search for in the course content"),
                                PARAM_COURSE_NAME, Map.of(
                                        "type", TYPE_STRING,
                                        "description",
                                        "Course title (partial matches work, e.g. 'MCP', 'Introduction')"),
                                PARAM_LESSON_NUMBER, Map.of(
                                        "type", TYPE_INTEGER,
                                        "description", "Specific lesson number to search within (e.g. 1, 2, 3)")),
                        "required", List.of(PARAM_QUERY)))
                .build();
    }

    @Override
    public String execute(Map<String, Object> arguments, List<Source> sources) {
        String query = String.valueOf(arguments.get(PARAM_QUERY));
        String courseName = optionalString(arguments.get(PARAM_COURSE_NAME));

        Object rawLesson = arguments.get(PARAM_LESSON_NUMBER);
        Integer lessonNumber = null;
        if (rawLesson != null) {
            lessonNumber = toInteger(rawLesson);
            if (lessonNumber == null) {
                return "Error: lesson_number must be an integer, got '" + rawLesson + "'";
            }
        }

        log.debug("[Tools] Course search: query='{}', course={}, lesson={}", query, courseName, lessonNumber);
        SearchResults results = courseSearchPort.search(query, courseName, lessonNumber);

        if (results.hasError()) {
            return results.error();
        }
        if (results.isEmpty()) {
            return emptyResultMessage(courseName, lessonNumber);
        }
        return formatResults(results, sources);
    }

    private String formatResults(SearchResults results, List<Source> sources) {
        List<String> formatted = new ArrayList<>();
        List<String> documents = results.documents();
        List<Map<String, Object>> metadata = results.metadata();

        for (int i = 0; i < documents.size(); i++) {
            Map<String, Object> meta = i < metadata.size() && metadata.get(i) != null ? metadata.get(i) : Map.of();
            Object title = meta.get(META_COURSE_TITLE);
            String courseTitle = title != null ? title.toString() : "unknown";
            Integer lesson = toInteger(meta.get(META_LESSON_NUMBER));

            String label = lesson != null ? courseTitle + " - Lesson " + lesson : courseTitle;
            formatted.add("[" + label + "]\n" + documents.get(i));

            sources.add(Source.of(label, lesson != null ? lessonLink(courseTitle, lesson) : null));
        }
        return String.join("\n\n", formatted);
    }

    private String lessonLink(String courseTitle, int lessonNumber) {
        try {
            return courseSearchPort.getLessonLink(courseTitle, lessonNumber).orElse(null);
        } catch (RetrievalException e) {
            log.debug("[Tools] No lesson link for '{}' lesson {}: {}", courseTitle, lessonNumber, e.getMessage());
            return null;
        }
    }

    private static String emptyResultMessage(String courseName, Integer lessonNumber) {
        StringBuilder sb = new StringBuilder("No relevant content found");
        if (courseName != null) {
            sb.append(" in course '").append(courseName).append("'");
        }
        if (lessonNumber != null) {
            sb.append(" in lesson ").append(lessonNumber);
        }
        return sb.append('.').toString();
    }

    private static String optionalString(Object value) {
        if (value == null) {
            return null;
        }
        String text = value.toString();
        return text.isBlank() ? null : text;
    }

    static Integer toInteger(Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Number n) {
            double d = n.doubleValue();
            if (d == Math.rint(d) && d >= Integer.MIN_VALUE && d <= Integer.MAX_VALUE) {
                return (int) d;
            }
            return null;
        }
        if (value instanceof String s) {
            try {
                return Integer.parseInt(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
