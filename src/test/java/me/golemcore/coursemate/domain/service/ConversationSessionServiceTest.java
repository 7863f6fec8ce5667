package me.golemcore.coursemate.domain.service;

import me.golemcore.coursemate.domain.model.Exchange;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ConversationSessionServiceTest {

    private static final String SESSION_ID = "session_1";

    private CoursemateProperties properties;
    private ConversationSessionService service;

    @BeforeEach
    void setUp() {
        properties = new CoursemateProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-02-14T00:00:00Z"), ZoneId.of("UTC"));
        service = new ConversationSessionService(properties, clock);
    }

    @Test
    void shouldMintDistinctSessionIds() {
        String first = service.createSession();
        String second = service.createSession();

        assertTrue(first.startsWith("session_"));
        assertNotEquals(first, second);
    }

    @Test
    void shouldReturnEmptyHistoryForUnknownOrNullSession() {
        assertEquals("", service.getHistory("missing"));
        assertEquals("", service.getHistory(null));
        assertTrue(service.getExchanges(null).isEmpty());
    }

    @Test
    void shouldFormatHistoryOldestFirst() {
        service.append(SESSION_ID, "What is MCP?", "A protocol.");
        service.append(SESSION_ID, "Who teaches it?", "Elie.");

        String history = service.getHistory(SESSION_ID);

        assertEquals("User: What is MCP?\nAssistant: A protocol.\nUser: Who teaches it?\nAssistant: Elie.",
                history);
    }

    @Test
    void shouldCreateSessionLazilyOnFirstAppend() {
        assertTrue(service.getExchanges(SESSION_ID).isEmpty());

        service.append(SESSION_ID, "q", "a");

        assertEquals(List.of(new Exchange("q", "a")), service.getExchanges(SESSION_ID));
    }

    @Test
    void shouldKeepOnlyMostRecentExchangesBeyondCapacity() {
        int capacity = properties.getSession().getHistoryCapacity();
        for (int i = 1; i <= capacity + 3; i++) {
            service.append(SESSION_ID, "q" + i, "a" + i);
        }

        List<Exchange> exchanges = service.getExchanges(SESSION_ID);

        assertEquals(capacity, exchanges.size());
        assertEquals(new Exchange("q4", "a4"), exchanges.get(0));
        assertEquals(new Exchange("q5", "a5"), exchanges.get(1));
    }

    @Test
    void shouldHonorConfiguredCapacity() {
        properties.getSession().setHistoryCapacity(4);
        for (int i = 1; i <= 6; i++) {
            service.append(SESSION_ID, "q" + i, "a" + i);
        }

        assertEquals(4, service.getExchanges(SESSION_ID).size());
        assertEquals("q3", service.getExchanges(SESSION_ID).get(0).question());
    }

    @Test
    void shouldDropHistoryOnReset() {
        service.append(SESSION_ID, "q", "a");

        service.reset(SESSION_ID);

        assertEquals("", service.getHistory(SESSION_ID));
        assertTrue(service.getExchanges(SESSION_ID).isEmpty());
    }

    @Test
    void shouldKeepSessionsIndependent() {
        service.append("session_a", "qa", "aa");
        service.append("session_b", "qb", "ab");

        assertEquals("User: qa\nAssistant: aa", service.getHistory("session_a"));
        assertEquals("User: qb\nAssistant: ab", service.getHistory("session_b"));
    }

    @Test
    void shouldNeverExceedCapacityUnderConcurrentAppends() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int thread = t;
                futures.add(executor.submit(() -> {
                    start.await();
                    for (int i = 0; i < 50; i++) {
                        service.append(SESSION_ID, "q" + thread + "-" + i, "a");
                        assertTrue(service.getExchanges(SESSION_ID).size() <= 2);
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(2, service.getExchanges(SESSION_ID).size());
    }
}
