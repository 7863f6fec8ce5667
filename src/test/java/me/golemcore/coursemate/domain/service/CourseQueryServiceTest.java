package me.golemcore.coursemate.domain.service;

import me.golemcore.coursemate.domain.model.Message;
import me.golemcore.coursemate.domain.model.QueryAnswer;
import me.golemcore.coursemate.domain.model.RunContext;
import me.golemcore.coursemate.domain.model.Source;
import me.golemcore.coursemate.domain.system.toolloop.ToolLoopSystem;
import me.golemcore.coursemate.domain.system.toolloop.ToolLoopTurnResult;
import me.golemcore.coursemate.infrastructure.config.CoursemateProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CourseQueryServiceTest {

    private static final Instant NOW = Instant.parse("2026-02-14T09:30:00Z");

    private CoursemateProperties properties;
    private ToolLoopSystem toolLoopSystem;
    private ConversationSessionService sessionService;
    private CourseQueryService service;

    @BeforeEach
    void setUp() {
        properties = new CoursemateProperties();
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        toolLoopSystem = mock(ToolLoopSystem.class);
        sessionService = new ConversationSessionService(properties, clock);
        service = new CourseQueryService(toolLoopSystem, sessionService, properties, clock);
    }

    private void answerWith(String answer, Source... sources) {
        when(toolLoopSystem.processTurn(any(), anyInt())).thenAnswer(inv -> {
            RunContext context = inv.getArgument(0);
            context.getSources().addAll(List.of(sources));
            return new ToolLoopTurnResult(context, answer, 1, sources.length, false);
        });
    }

    private RunContext capturedContext() {
        ArgumentCaptor<RunContext> captor = ArgumentCaptor.forClass(RunContext.class);
        verify(toolLoopSystem).processTurn(captor.capture(), anyInt());
        return captor.getValue();
    }

    @Test
    void shouldRejectBlankQuery() {
        assertThrows(IllegalArgumentException.class, () -> service.run("   ", "session_1", 2));
        assertThrows(IllegalArgumentException.class, () -> service.run(null, null, 2));
        verify(toolLoopSystem, never()).processTurn(any(), anyInt());
    }

    @Test
    void shouldStartRunWithSingleUserMessage() {
        answerWith("4");

        service.run("What is 2+2?", null, 2);

        RunContext context = capturedContext();
        assertEquals(1, context.getMessages().size());
        assertEquals(Message.ROLE_USER, context.getMessages().get(0).getRole());
        assertEquals("What is 2+2?", context.getMessages().get(0).getText());
        assertEquals(NOW, context.getMessages().get(0).getTimestamp());
    }

    @Test
    void shouldUsePlainSystemPromptWithoutHistory() {
        answerWith("answer");

        service.run("question", "session_1", 2);

        assertEquals(SystemPrompts.courseAssistant(2), capturedContext().getSystemPrompt());
    }

    @Test
    void shouldStateRoundBudgetInSystemPrompt() {
        answerWith("answer");

        service.run("question", "session_1", 4);

        String prompt = capturedContext().getSystemPrompt();
        assertTrue(prompt.contains("(at most 4 rounds in total)"));
        assertFalse(prompt.contains("%d"));
    }

    @Test
    void shouldStateConfiguredRoundBudgetByDefault() {
        properties.getToolLoop().setMaxRounds(3);
        answerWith("answer");

        service.run("question", "session_1");

        assertTrue(capturedContext().getSystemPrompt().contains("(at most 3 rounds in total)"));
    }

    @Test
    void shouldAppendHistoryToSystemPrompt() {
        sessionService.append("session_1", "What is MCP?", "A protocol.");
        answerWith("answer");

        service.run("Who teaches it?", "session_1", 2);

        String prompt = capturedContext().getSystemPrompt();
        assertTrue(prompt.startsWith(SystemPrompts.courseAssistant(2)));
        assertTrue(prompt.endsWith("\n\nPrevious conversation:\nUser: What is MCP?\nAssistant: A protocol."));
    }

    @Test
    void shouldReturnAnswerWithSourcesRecordedDuringRun() {
        Source lesson = Source.of("Intro to Python - Lesson 0", "https://example.com/lesson0");
        answerWith("Python is versatile.", lesson);

        QueryAnswer answer = service.run("What is Python?", "session_1", 2);

        assertEquals("Python is versatile.", answer.answer());
        assertEquals(List.of(lesson), answer.sources());
        assertEquals("session_1", answer.sessionId());
    }

    @Test
    void shouldRecordExchangeForSession() {
        answerWith("A protocol.");

        service.run("What is MCP?", "session_1", 2);

        assertEquals("User: What is MCP?\nAssistant: A protocol.", sessionService.getHistory("session_1"));
    }

    @Test
    void shouldNotRecordAnythingWithoutSession() {
        answerWith("4");

        QueryAnswer answer = service.run("What is 2+2?", null, 2);

        assertEquals("4", answer.answer());
        assertNull(answer.sessionId());
        assertTrue(sessionService.getExchanges(null).isEmpty());
    }

    @Test
    void shouldRecordErrorTextAsAnswer() {
        answerWith("Error in round 1: API down");

        service.run("question", "session_1", 2);

        assertEquals("Error in round 1: API down", sessionService.getExchanges("session_1").get(0).answer());
    }

    @Test
    void shouldUseConfiguredRoundsByDefault() {
        answerWith("ok");

        service.run("question", "session_1");

        verify(toolLoopSystem).processTurn(any(), eq(2));
    }
}
