package me.golemcore.coursemate.adapter.outbound.retrieval;

import me.golemcore.coursemate.domain.exception.RetrievalException;
import me.golemcore.coursemate.domain.model.CourseCatalog;
import me.golemcore.coursemate.domain.model.CourseOutline;
import me.golemcore.coursemate.domain.model.SearchResults;
import me.golemcore.coursemate.infrastructure.config.AutoConfiguration;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import okhttp3.mockwebserver.SocketPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HttpCourseSearchAdapterTest {

    private static final String CONTENT_TYPE = "Content-Type";
    private static final String APPLICATION_JSON = "application/json";

    private static final String PYTHON_OUTLINE = """
            {"title": "Introduction to Python",
             "link": "https://example.com/python-course",
             "instructor": "Dr. Smith",
             "lessons": [
               {"number": 0, "title": "Getting Started", "link": "https://example.com/lesson0"},
               {"number": 1, "title": "Variables and Data Types"}
             ]}""";

    private MockWebServer mockServer;
    private CoursemateProperties properties;
    private HttpCourseSearchAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        mockServer = new MockWebServer();
        mockServer.start();

        properties = new CoursemateProperties();
        properties.getRetrieval().setUrl(mockServer.url("/").toString());
        properties.getRetrieval().setTimeoutSeconds(5);

        OkHttpClient client = new OkHttpClient.Builder()
                .retryOnConnectionFailure(false)
                .build();
        adapter = new HttpCourseSearchAdapter(properties, client, AutoConfiguration.objectMapper());
    }

    @AfterEach
    void tearDown() throws IOException {
        mockServer.shutdown();
    }

    private void enqueueJson(String body) {
        mockServer.enqueue(new MockResponse()
                .setBody(body)
                .setHeader(CONTENT_TYPE, APPLICATION_JSON));
    }

    // ==================== search ====================

    @Test
    void searchSendsFiltersAndParsesHits() throws Exception {
        enqueueJson("""
                {"documents": ["Welcome to Python programming."],
                 "metadata": [{"course_title": "Introduction to Python", "lesson_number": 0}],
                 "error": null}""");

        SearchResults results = adapter.search("getting started", "Python", 0);

        assertFalse(results.hasError());
        assertEquals(List.of("Welcome to Python programming."), results.documents());
        assertEquals("Introduction to Python", results.metadata().get(0).get("course_title"));
        assertEquals(0, results.metadata().get(0).get("lesson_number"));

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("POST", request.getMethod());
        assertEquals("/search", request.getPath());
        String body = request.getBody().readUtf8();
        assertTrue(body.contains("\"query\":\"getting started\""));
        assertTrue(body.contains("\"course_name\":\"Python\""));
        assertTrue(body.contains("\"lesson_number\":0"));
        assertTrue(body.contains("\"limit\":5"));
    }

    @Test
    void searchReturnsServiceReportedError() {
        enqueueJson("{\"documents\": [], \"metadata\": [], \"error\": \"No course found matching 'Cooking'\"}");

        SearchResults results = adapter.search("q", "Cooking", null);

        assertTrue(results.hasError());
        assertEquals("No course found matching 'Cooking'", results.error());
    }

    @Test
    void searchReturnsErrorOnHttpFailure() {
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        SearchResults results = adapter.search("q", null, null);

        assertTrue(results.hasError());
        assertTrue(results.error().startsWith("Search error:"));
        assertTrue(results.documents().isEmpty());
    }

    @Test
    void searchReturnsErrorWhenConnectionDrops() {
        mockServer.enqueue(new MockResponse().setSocketPolicy(SocketPolicy.DISCONNECT_AT_START));

        SearchResults results = adapter.search("q", null, null);

        assertTrue(results.hasError());
        assertTrue(results.error().startsWith("Search error:"));
    }

    @Test
    void searchReturnsErrorForMalformedMetadata() {
        enqueueJson("{\"documents\": [\"doc\"], \"metadata\": [\"not an object\"]}");

        SearchResults results = adapter.search("q", null, null);

        assertTrue(results.hasError());
        assertEquals("Search error: malformed response from retrieval service", results.error());
    }

    @Test
    void searchToleratesNullMetadataEntry() {
        enqueueJson("{\"documents\": [\"doc\"], \"metadata\": [null]}");

        SearchResults results = adapter.search("q", null, null);

        assertFalse(results.hasError());
        assertEquals(List.of("doc"), results.documents());
        assertTrue(results.metadata().get(0).isEmpty());
    }

    @Test
    void searchSendsBearerTokenWhenConfigured() throws Exception {
        properties.getRetrieval().setApiKey("secret");
        enqueueJson("{\"documents\": [], \"metadata\": []}");

        adapter.search("q", null, null);

        assertEquals("Bearer secret", mockServer.takeRequest().getHeader("Authorization"));
    }

    @Test
    void searchOmitsAuthorizationWithoutApiKey() throws Exception {
        enqueueJson("{\"documents\": [], \"metadata\": []}");

        SearchResults results = adapter.search("q", null, null);

        assertTrue(results.isEmpty());
        assertNull(mockServer.takeRequest().getHeader("Authorization"));
    }

    // ==================== outline ====================

    @Test
    void outlineIsParsedAndCached() throws Exception {
        enqueueJson(PYTHON_OUTLINE);

        Optional<CourseOutline> first = adapter.getCourseOutline("Python");
        Optional<CourseOutline> second = adapter.getCourseOutline("Python");

        assertTrue(first.isPresent());
        assertEquals("Dr. Smith", first.get().getInstructor());
        assertEquals(2, first.get().getLessons().size());
        assertEquals(first, second);
        assertEquals(1, mockServer.getRequestCount());

        RecordedRequest request = mockServer.takeRequest();
        assertEquals("/outline", request.getPath());
        assertTrue(request.getBody().readUtf8().contains("\"course_title\":\"Python\""));
    }

    @Test
    void outlineCacheEvictsLeastRecentlyUsedEntries() throws Exception {
        properties.getRetrieval().setOutlineCacheSize(2);
        adapter = new HttpCourseSearchAdapter(properties, new OkHttpClient.Builder()
                .retryOnConnectionFailure(false)
                .build(), AutoConfiguration.objectMapper());
        enqueueJson("{\"title\": \"Python\", \"lessons\": []}");
        enqueueJson("{\"title\": \"MCP\", \"lessons\": []}");
        enqueueJson("{\"title\": \"Data Structures\", \"lessons\": []}");
        enqueueJson("{\"title\": \"MCP\", \"lessons\": []}");

        adapter.getCourseOutline("Python");
        adapter.getCourseOutline("MCP");
        adapter.getCourseOutline("Python");
        adapter.getCourseOutline("Data Structures");
        assertEquals(3, mockServer.getRequestCount());

        // Python was used more recently than MCP, so MCP went first
        adapter.getCourseOutline("Python");
        assertEquals(3, mockServer.getRequestCount());
        adapter.getCourseOutline("MCP");
        assertEquals(4, mockServer.getRequestCount());
    }

    @Test
    void outlineIsEmptyForUnknownCourse() {
        mockServer.enqueue(new MockResponse().setResponseCode(404));

        assertTrue(adapter.getCourseOutline("Cooking").isEmpty());
    }

    @Test
    void outlineThrowsOnServerError() {
        mockServer.enqueue(new MockResponse().setResponseCode(503));

        assertThrows(RetrievalException.class, () -> adapter.getCourseOutline("Python"));
    }

    @Test
    void lessonLinkComesFromOutline() {
        enqueueJson(PYTHON_OUTLINE);

        assertEquals(Optional.of("https://example.com/lesson0"), adapter.getLessonLink("Introduction to Python", 0));
        assertEquals(Optional.empty(), adapter.getLessonLink("Introduction to Python", 1));
        assertEquals(Optional.empty(), adapter.getLessonLink("Introduction to Python", 7));
        assertEquals(1, mockServer.getRequestCount());
    }

    // ==================== catalog ====================

    @Test
    void catalogIsParsed() throws Exception {
        enqueueJson("{\"total_courses\": 2, \"course_titles\": [\"Introduction to Python\", \"Data Structures\"]}");

        CourseCatalog catalog = adapter.getCatalog();

        assertEquals(2, catalog.totalCourses());
        assertEquals(List.of("Introduction to Python", "Data Structures"), catalog.courseTitles());
        RecordedRequest request = mockServer.takeRequest();
        assertEquals("GET", request.getMethod());
        assertEquals("/catalog", request.getPath());
    }

    @Test
    void catalogThrowsOnHttpFailure() {
        mockServer.enqueue(new MockResponse().setResponseCode(500));

        assertThrows(RetrievalException.class, () -> adapter.getCatalog());
    }
}
