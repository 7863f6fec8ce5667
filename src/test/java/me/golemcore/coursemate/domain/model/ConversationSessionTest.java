package me.golemcore.coursemate.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class ConversationSessionTest {

    @Test
    void shouldEvictOldestExchangeWhenFull() {
        ConversationSession session = ConversationSession.builder().id("session_1").capacity(2).build();

        session.addExchange(new Exchange("q1", "a1"));
        session.addExchange(new Exchange("q2", "a2"));
        session.addExchange(new Exchange("q3", "a3"));

        assertEquals(List.of(new Exchange("q2", "a2"), new Exchange("q3", "a3")), session.snapshot());
    }

    @Test
    void shouldReturnDetachedSnapshot() {
        ConversationSession session = ConversationSession.builder().id("session_1").capacity(2).build();
        session.addExchange(new Exchange("q1", "a1"));

        List<Exchange> snapshot = session.snapshot();
        session.addExchange(new Exchange("q2", "a2"));

        assertEquals(1, snapshot.size());
        assertEquals(2, session.snapshot().size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.add(new Exchange("q", "a")));
    }
}
