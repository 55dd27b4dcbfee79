package io.agentbus.agent.client;

import java.util.concurrent.CompletableFuture;

/**
 * Headline collaborator (NewsAPI.org in production).
 */
@FunctionalInterface
public interface NewsClient {

    /**
     * @param category one of {@code NewsAgentAdapter.CATEGORIES}, or null
     * @param keyword  free-text filter, or null
     * @param country  lower-case two-letter country code
     */
    CompletableFuture<NewsResult> topHeadlines(String category, String keyword, String country);
}
