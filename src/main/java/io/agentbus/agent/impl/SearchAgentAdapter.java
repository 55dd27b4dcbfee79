package io.agentbus.agent.impl;

import io.agentbus.agent.client.SearchClient;
import io.agentbus.agent.client.SearchHit;
import io.agentbus.agent.client.SearchResult;
import io.agentbus.agent.model.AgentResponse;
import io.agentbus.agent.model.RoutingMetadata;
import io.agentbus.agent.type.AbstractAgentAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Web and news search over a {@link SearchClient}.
 * <p>
 * Functions: {@code search_web(query, max_results)} and {@code search_news(query, max_results)}.
 * {@code max_results} is clamped to 1..10.
 * </p>
 */
@Slf4j
public final class SearchAgentAdapter extends AbstractAgentAdapter {

    public static final String NAME = "web_search_agent";
    public static final String SEARCH_WEB = "search_web";
    public static final String SEARCH_NEWS = "search_news";

    public static final String QUERY = "query";
    public static final String MAX_RESULTS = "max_results";

    static final int MAX_RESULTS_CAP = 10;
    static final int WEB_SNIPPET_CHARS = 200;
    static final int NEWS_SNIPPET_CHARS = 250;
    /* shorter snippets are noise (navigation text, single words) */
    private static final int MIN_SNIPPET_CHARS = 10;

    private final SearchClient client;
    private final int defaultMaxResults;

    public SearchAgentAdapter(final SearchClient client, final int defaultMaxResults) {
        super(NAME);
        this.client = Objects.requireNonNull(client, "client");
        this.defaultMaxResults = defaultMaxResults;

        register(SEARCH_WEB, List.of(QUERY), (params, routing) -> search(params, routing, false));
        register(SEARCH_NEWS, List.of(QUERY), (params, routing) -> search(params, routing, true));
    }

    private CompletableFuture<AgentResponse> search(final Map<String, Object> params,
                                                    final RoutingMetadata routing,
                                                    final boolean news) {
        final String query = stringParam(params, QUERY);
        final int maxResults = intParam(params, MAX_RESULTS, defaultMaxResults, 1, MAX_RESULTS_CAP);

        log.info("Searching {} for: {}", news ? "news" : "web", query);
        return client.search(news ? query + " news" : query)
                .thenApply(result -> toResponse(query, result, maxResults, news, routing));
    }

    private AgentResponse toResponse(final String query,
                                     final SearchResult result,
                                     final int maxResults,
                                     final boolean news,
                                     final RoutingMetadata routing) {
        if (result.failed()) {
            log.warn("Search for '{}' failed: {}", query, result.error());
            return AgentResponse.error("Search failed: " + result.error(), routing);
        }
        return AgentResponse.text(news ? formatNews(query, result.hits(), maxResults) : formatWeb(query, result.hits(), maxResults), routing);
    }

    static String formatWeb(final String query, final List<SearchHit> hits, final int maxResults) {
        if (hits.isEmpty()) {
            return "No search results found for '" + query + "'. Please try a different search term.";
        }
        final int shown = Math.min(maxResults, hits.size());
        final StringBuilder sb = new StringBuilder()
                .append("Top ").append(shown).append(" search results for '").append(query).append("':\n\n");
        appendHits(sb, hits.subList(0, shown), WEB_SNIPPET_CHARS);
        return sb.toString();
    }

    static String formatNews(final String query, final List<SearchHit> hits, final int maxResults) {
        if (hits.isEmpty()) {
            return "No news results found for '" + query + "'. Please try a different search term.";
        }
        final int shown = Math.min(maxResults, hits.size());
        final StringBuilder sb = new StringBuilder()
                .append("Latest news about '").append(query).append("' (").append(shown).append(" articles):\n\n");
        appendHits(sb, hits.subList(0, shown), NEWS_SNIPPET_CHARS);
        return sb.toString();
    }

    private static void appendHits(final StringBuilder sb, final List<SearchHit> hits, final int snippetChars) {
        for (final SearchHit hit : hits) {
            sb.append("* ").append(hit.title() == null ? "No Title" : hit.title()).append('\n');
            final String snippet = hit.snippet();
            if (snippet != null && snippet.length() > MIN_SNIPPET_CHARS) {
                sb.append("   ").append(truncate(snippet, snippetChars)).append('\n');
            }
            sb.append("   ").append(hit.url() == null ? "#" : hit.url()).append("\n\n");
        }
    }
}
