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
import me.golemcore.coursemate.domain.model.CourseOutline;
import me.golemcore.coursemate.domain.model.Source;
import me.golemcore.coursemate.domain.model.ToolDefinition;
import me.golemcore.coursemate.port.outbound.CourseSearchPort;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Tool returning a course outline: title, link, instructor and the ordered
 * lesson list.
 */
@Component
@Order(2)
@RequiredArgsConstructor
@Slf4j
public class CourseOutlineTool implements ToolComponent {

    public static final String NAME = "get_course_outline";

    private static final String PARAM_COURSE_TITLE = "course_title";

    private final CourseSearchPort courseSearchPort;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(NAME)
                .description("Get the outline of a course: title, course link, instructor "
                        + "and the complete lesson list with numbers, titles and links")
                .inputSchema(Map.of(
                        "type", "object",
                        "properties", Map.of(
                                PARAM_COURSE_TITLE, Map.of(
                                        "type", "string",
                                        "description", "Course title (partial matches work, e.g. 'MCP', 'Python')")),
                        "required", List.of(PARAM_COURSE_TITLE)))
                .build();
    }

    @Override
    public String execute(Map<String, Object> arguments, List<Source> sources) {
        String courseTitle = String.valueOf(arguments.get(PARAM_COURSE_TITLE));
        log.debug("[Tools] Course outline: {}", courseTitle);

        Optional<CourseOutline> outline;
        try {
            outline = courseSearchPort.getCourseOutline(courseTitle);
        } catch (RetrievalException e) {
            log.warn("[Tools] Outline lookup failed for '{}': {}", courseTitle, e.getMessage());
            return "Error: " + e.getMessage();
        }
        if (outline.isEmpty()) {
            return "No course found matching '" + courseTitle + "'.";
        }

        CourseOutline course = outline.get();
        sources.add(Source.of(course.getTitle(), course.getLink()));
        return render(course);
    }

    private static String render(CourseOutline course) {
        StringBuilder sb = new StringBuilder();
        sb.append("Course Title: ").append(course.getTitle()).append('\n');
        if (course.getLink() != null) {
            sb.append("Course Link: ").append(course.getLink()).append('\n');
        }
        if (course.getInstructor() != null) {
            sb.append("Course Instructor: ").append(course.getInstructor()).append('\n');
        }

        List<CourseOutline.Lesson> lessons = course.getLessons() == null ? List.of()
                : course.getLessons().stream()
                        .sorted(Comparator.comparingInt(CourseOutline.Lesson::getNumber))
                        .toList();
        sb.append("\nLessons (").append(lessons.size()).append("):");
        for (CourseOutline.Lesson lesson : lessons) {
            sb.append("\nLesson ").append(lesson.getNumber()).append(": ").append(lesson.getTitle());
            if (lesson.getLink() != null) {
                sb.append(" - ").append(lesson.getLink());
            }
        }
        return sb.toString();
    }
}
