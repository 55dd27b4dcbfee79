package io.agentbus.agent.client;

import java.util.List;

/**
 * Result of a search: either hits or an error detail reported by the collaborator.
 */
public record SearchResult(List<SearchHit> hits, String error) {

    public SearchResult {
        hits = hits == null ? List.of() : List.copyOf(hits);
    }

    public static SearchResult of(final List<SearchHit> hits) {
        return new SearchResult(hits, null);
    }

    public static SearchResult failure(final String error) {
        return new SearchResult(List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }
}
