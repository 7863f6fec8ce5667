package me.golemcore.coursemate.domain.model;

import java.util.List;

/**
 * Result of a query run: the final answer text and the sources the tools
 * recorded while producing it.
 */
public record QueryAnswer(String answer, List<Source> sources, String sessionId) {

    public QueryAnswer {
        sources = sources != null ? List.copyOf(sources) : List.of();
    }
}
