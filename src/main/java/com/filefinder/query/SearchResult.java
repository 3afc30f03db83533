package com.filefinder.query;

import java.util.List;

public record SearchResult(
        List<SearchHit> hits,
        int candidateCount,
        long elapsedMs,
        String query
) {
    public static SearchResult empty(String query) {
        return new SearchResult(List.of(), 0, 0L, query);
    }
}
