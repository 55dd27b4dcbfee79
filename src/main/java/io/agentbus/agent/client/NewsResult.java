package io.agentbus.agent.client;

import java.util.List;

/**
 * Top headlines or an error detail reported by the collaborator.
 */
public record NewsResult(List<NewsArticle> articles, String error) {

    public NewsResult {
        articles = articles == null ? List.of() : List.copyOf(articles);
    }

    public static NewsResult of(final List<NewsArticle> articles) {
        return new NewsResult(articles, null);
    }

    public static NewsResult failure(final String error) {
        return new NewsResult(List.of(), error);
    }

    public boolean failed() {
        return error != null;
    }
}
