package me.golemcore.coursemate.domain.model;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a course content search. When {@code error} is set the search
 * failed and documents are empty.
 */
public record SearchResults(List<String> documents, List<Map<String, Object>> metadata, String error) {

    public SearchResults {
        documents = documents != null ? List.copyOf(documents) : List.of();
        metadata = metadata != null ? List.copyOf(metadata) : List.of();
    }

    public static SearchResults empty() {
        return new SearchResults(List.of(), List.of(), null);
    }

    public static SearchResults failure(String error) {
        return new SearchResults(List.of(), List.of(), error);
    }

    public boolean hasError() {
        return error != null && !error.isBlank();
    }

    public boolean isEmpty() {
        return documents.isEmpty();
    }
}
