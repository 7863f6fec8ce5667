package me.golemcore.coursemate.adapter.inbound.web.controller;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.coursemate.adapter.inbound.web.dto.CourseStatsResponse;
import me.golemcore.coursemate.adapter.inbound.web.dto.NewSessionRequest;
import me.golemcore.coursemate.adapter.inbound.web.dto.NewSessionResponse;
import me.golemcore.coursemate.adapter.inbound.web.dto.QueryRequest;
import me.golemcore.coursemate.adapter.inbound.web.dto.QueryResponse;
import me.golemcore.coursemate.domain.model.CourseCatalog;
import me.golemcore.coursemate.domain.model.QueryAnswer;
import me.golemcore.coursemate.domain.service.ConversationSessionService;
import me.golemcore.coursemate.domain.service.CourseQueryService;
import me.golemcore.coursemate.port.outbound.CourseSearchPort;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Chat front-end endpoints: ask a question, start a new session, clear a
 * session and list the indexed courses.
 *
 * <p>
 * Query runs block on the LLM and the retrieval service, so they are moved off
 * the event loop.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class QueryController {

    private final CourseQueryService courseQueryService;
    private final ConversationSessionService sessionService;
    private final CourseSearchPort courseSearchPort;

    @PostMapping("/query")
    public Mono<ResponseEntity<QueryResponse>> query(@RequestBody QueryRequest request) {
        if (request == null || request.getQuery() == null || request.getQuery().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "query is required");
        }
        String sessionId = request.getSessionId() != null && !request.getSessionId().isBlank()
                ? request.getSessionId()
                : sessionService.createSession();

        return Mono.fromCallable(() -> courseQueryService.run(request.getQuery(), sessionId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(answer -> ResponseEntity.ok(toResponse(answer)));
    }

    @PostMapping("/new-session")
    public Mono<ResponseEntity<NewSessionResponse>> newSession(
            @RequestBody(required = false) NewSessionRequest request) {
        if (request != null && request.getPreviousSessionId() != null) {
            sessionService.reset(request.getPreviousSessionId());
        }
        String sessionId = sessionService.createSession();
        log.debug("[API] New session: {}", sessionId);
        return Mono.just(ResponseEntity.ok(NewSessionResponse.builder().sessionId(sessionId).build()));
    }

    @DeleteMapping("/sessions/{id}")
    public Mono<ResponseEntity<Void>> clearSession(@PathVariable String id) {
        sessionService.reset(id);
        return Mono.just(ResponseEntity.noContent().build());
    }

    @GetMapping("/courses")
    public Mono<ResponseEntity<CourseStatsResponse>> courses() {
        return Mono.fromCallable(courseSearchPort::getCatalog)
                .subscribeOn(Schedulers.boundedElastic())
                .map(catalog -> ResponseEntity.ok(toStats(catalog)));
    }

    private static QueryResponse toResponse(QueryAnswer answer) {
        return QueryResponse.builder()
                .answer(answer.answer())
                .sources(answer.sources())
                .sessionId(answer.sessionId())
                .build();
    }

    private static CourseStatsResponse toStats(CourseCatalog catalog) {
        return CourseStatsResponse.builder()
                .totalCourses(catalog.totalCourses())
                .courseTitles(catalog.courseTitles())
                .build();
    }
}
