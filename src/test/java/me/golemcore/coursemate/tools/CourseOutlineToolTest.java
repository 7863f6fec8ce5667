package me.golemcore.coursemate.tools;

import me.golemcore.coursemate.domain.exception.RetrievalException;
import me.golemcore.coursemate.domain.model.CourseOutline;
import me.golemcore.coursemate.domain.model.Source;
import me.golemcore.coursemate.port.outbound.CourseSearchPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class CourseOutlineToolTest {

    private CourseSearchPort courseSearchPort;
    private CourseOutlineTool tool;
    private List<Source> sources;

    @BeforeEach
    void setUp() {
        courseSearchPort = mock(CourseSearchPort.class);
        tool = new CourseOutlineTool(courseSearchPort);
        sources = new ArrayList<>();
    }

    private static CourseOutline pythonCourse() {
        return CourseOutline.builder()
                .title("Introduction to Python")
                .link("https://example.com/python-course")
                .instructor("Dr. Smith")
                .lessons(List.of(
                        new CourseOutline.Lesson(1, "Variables and Data Types", null),
                        new CourseOutline.Lesson(0, "Getting Started", "https://example.com/lesson0")))
                .build();
    }

    @Test
    void execute_rendersOutlineWithOrderedLessons() {
        when(courseSearchPort.getCourseOutline("Python")).thenReturn(Optional.of(pythonCourse()));

        String result = tool.execute(Map.of("course_title", "Python"), sources);

        assertEquals("Course Title: Introduction to Python\n"
                + "Course Link: https://example.com/python-course\n"
                + "Course Instructor: Dr. Smith\n"
                + "\nLessons (2):"
                + "\nLesson 0: Getting Started - https://example.com/lesson0"
                + "\nLesson 1: Variables and Data Types", result);
    }

    @Test
    void execute_citesCourse() {
        when(courseSearchPort.getCourseOutline("Python")).thenReturn(Optional.of(pythonCourse()));

        tool.execute(Map.of("course_title", "Python"), sources);

        assertEquals(1, sources.size());
        assertEquals(Source.of("Introduction to Python", "https://example.com/python-course"), sources.get(0));
    }

    @Test
    void execute_withUnknownCourse_returnsNotFound() {
        when(courseSearchPort.getCourseOutline("Cooking")).thenReturn(Optional.empty());

        String result = tool.execute(Map.of("course_title", "Cooking"), sources);

        assertEquals("No course found matching 'Cooking'.", result);
        assertTrue(sources.isEmpty());
    }

    @Test
    void execute_whenRetrievalFails_returnsErrorText() {
        when(courseSearchPort.getCourseOutline("Python"))
                .thenThrow(new RetrievalException("Outline lookup failed: HTTP 500"));

        String result = tool.execute(Map.of("course_title", "Python"), sources);

        assertEquals("Error: Outline lookup failed: HTTP 500", result);
    }

    @Test
    void getDefinition_requiresCourseTitle() {
        assertEquals("get_course_outline", tool.getDefinition().getName());
        assertEquals(List.of("course_title"), tool.getDefinition().getRequired());
    }
}
