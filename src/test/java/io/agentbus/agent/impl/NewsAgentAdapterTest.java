package io.agentbus.agent.impl;

import io.agentbus.agent.client.NewsArticle;
import io.agentbus.agent.client.NewsClient;
import io.agentbus.agent.client.NewsResult;
import io.agentbus.agent.model.AgentRequest;
import io.agentbus.agent.model.AgentResponse;
import io.agentbus.agent.model.ErrorContent;
import io.agentbus.agent.model.RoutingMetadata;
import io.agentbus.agent.model.TextContent;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

final class NewsAgentAdapterTest {

    private static final RoutingMetadata ROUTING = new RoutingMetadata("orchestrator", "msg-9", "conv-3");

    /* Remembers each lookup as "category|keyword|country". */
    private static final class StubClient implements NewsClient {
        final List<String> lookups = new ArrayList<>();
        private final NewsResult result;

        StubClient(final NewsResult result) {
            this.result = result;
        }

        @Override
        public CompletableFuture<NewsResult> topHeadlines(final String category, final String keyword, final String country) {
            lookups.add(category + "|" + keyword + "|" + country);
            return CompletableFuture.completedFuture(result);
        }
    }

    private static List<NewsArticle> articles(final int n) {
        return IntStream.rangeClosed(1, n)
                .mapToObj(i -> new NewsArticle("Headline " + i, "Source " + i, "https://news.example/" + i,
                        "Description of story number " + i))
                .collect(Collectors.toList());
    }

    private static AgentResponse call(final NewsAgentAdapter adapter, final Map<String, Object> params) throws Exception {
        return adapter.handle(AgentRequest.of("get_latest_news", params, ROUTING)).get(5, TimeUnit.SECONDS);
    }

    private static String text(final AgentResponse response) {
        assertFalse(response.isError(), () -> "unexpected error: " + response.content());
        return ((TextContent) response.content()).text();
    }

    private static String error(final AgentResponse response) {
        assertTrue(response.isError(), () -> "expected error, got: " + response.content());
        return ((ErrorContent) response.content()).message();
    }

    @Test
    void exposesItsFunction() {
        final NewsAgentAdapter adapter = new NewsAgentAdapter(new StubClient(NewsResult.of(List.of())), "us");
        assertEquals("news_agent", adapter.name());
        assertEquals(Set.of("get_latest_news"), adapter.functions());
    }

    @Test
    void categorySearchUsesDefaultCountryAndListsAtMostFiveArticles() throws Exception {
        final StubClient client = new StubClient(NewsResult.of(articles(7)));
        final NewsAgentAdapter adapter = new NewsAgentAdapter(client, "us");

        final String text = text(call(adapter, Map.of("category", "Technology")));

        assertEquals(List.of("technology|null|us"), client.lookups);
        assertTrue(text.startsWith("Latest news for technology category (US):"), text);
        assertTrue(text.contains("* Headline 1\n   Source: Source 1\n"));
        assertTrue(text.contains("https://news.example/5"));
        assertFalse(text.contains("Headline 6"));
    }

    @Test
    void keywordAndCategoryAreCombinedInTheHeader() throws Exception {
        final StubClient client = new StubClient(NewsResult.of(articles(1)));
        final NewsAgentAdapter adapter = new NewsAgentAdapter(client, "us");

        final String text = text(call(adapter, Map.of("category", "science", "keyword", "mars", "country", "GB")));

        assertEquals(List.of("science|mars|gb"), client.lookups);
        assertTrue(text.startsWith("Latest news for 'mars' in science category (GB):"), text);
    }

    @Test
    void keywordOnlySearch() throws Exception {
        final NewsAgentAdapter adapter = new NewsAgentAdapter(new StubClient(NewsResult.of(articles(1))), "ca");

        assertTrue(text(call(adapter, Map.of("keyword", "elections"))).startsWith("Latest news for 'elections' (CA):"));
    }

    @Test
    void neitherCategoryNorKeywordIsRejectedWithoutCallingTheClient() throws Exception {
        final StubClient client = new StubClient(NewsResult.of(articles(1)));
        final NewsAgentAdapter adapter = new NewsAgentAdapter(client, "us");

        final AgentResponse response = call(adapter, Map.of("country", "us", "keyword", " "));

        assertEquals("Please specify either a category or keyword to search for news.", error(response));
        assertEquals(ROUTING, response.routing());
        assertTrue(client.lookups.isEmpty());
    }

    @Test
    void unknownCategoryIsRejected() throws Exception {
        final StubClient client = new StubClient(NewsResult.of(articles(1)));
        final NewsAgentAdapter adapter = new NewsAgentAdapter(client, "us");

        assertTrue(error(call(adapter, Map.of("category", "gossip"))).startsWith("Unsupported news category 'gossip'"));
        assertTrue(client.lookups.isEmpty());
    }

    @Test
    void emptyResultNamesTheFilters() {
        assertEquals("No news articles found for category 'sports' and keyword 'chess' in US.",
                NewsAgentAdapter.format("sports", "chess", "us", NewsResult.of(List.of())));
        assertEquals("No news articles found for keyword 'chess' in DE.",
                NewsAgentAdapter.format(null, "chess", "de", NewsResult.of(List.of())));
    }

    @Test
    void descriptionsAreTruncatedAndPlaceholdersFilled() {
        final NewsResult result = NewsResult.of(List.of(
                new NewsArticle(null, null, null, "d".repeat(300)),
                new NewsArticle("Short", "Wire", "u", "tiny")));

        final String text = NewsAgentAdapter.format("general", null, "us", result);

        assertTrue(text.contains("* No Title\n   Source: Unknown Source\n"));
        assertTrue(text.contains("d".repeat(150) + "...\n   #"));
        assertFalse(text.contains("tiny"));
        assertTrue(text.endsWith("   u"), text);
    }

    @Test
    void collaboratorErrorIsReported() throws Exception {
        final NewsAgentAdapter adapter = new NewsAgentAdapter(new StubClient(NewsResult.failure("apiKeyInvalid")), "us");

        assertEquals("News lookup failed: apiKeyInvalid", error(call(adapter, Map.of("category", "health"))));
    }

    @Test
    void failedFutureBecomesAnExecutionError() throws Exception {
        final NewsClient failing = (category, keyword, country) ->
                CompletableFuture.failedFuture(new IllegalStateException("timeout"));
        final NewsAgentAdapter adapter = new NewsAgentAdapter(failing, "us");

        assertEquals("Error executing get_latest_news: timeout", error(call(adapter, Map.of("keyword", "ai"))));
    }
}
