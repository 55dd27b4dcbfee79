package io.agentbus.agent.client;

import java.util.concurrent.CompletableFuture;

/**
 * Web search collaborator (DuckDuckGo in production).
 * <p>
 * A failed lookup should be reported through {@link SearchResult#failure(String)}; a future that
 * completes exceptionally is treated as an unexpected fault by the caller.
 * </p>
 */
@FunctionalInterface
public interface SearchClient {
    CompletableFuture<SearchResult> search(String query);
}
