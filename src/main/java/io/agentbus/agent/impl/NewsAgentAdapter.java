package io.agentbus.agent.impl;

import io.agentbus.agent.client.NewsArticle;
import io.agentbus.agent.client.NewsClient;
import io.agentbus.agent.client.NewsResult;
import io.agentbus.agent.model.AgentResponse;
import io.agentbus.agent.model.RoutingMetadata;
import io.agentbus.agent.type.AbstractAgentAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Top headlines by category and/or keyword over a {@link NewsClient}.
 * <p>
 * Function: {@code get_latest_news(category, keyword, country)}. At least one of category and
 * keyword is needed; country defaults to the configured code.
 * </p>
 */
@Slf4j
public final class NewsAgentAdapter extends AbstractAgentAdapter {

    public static final String NAME = "news_agent";
    public static final String LATEST_NEWS = "get_latest_news";

    public static final String CATEGORY = "category";
    public static final String KEYWORD = "keyword";
    public static final String COUNTRY = "country";

    public static final Set<String> CATEGORIES =
            Set.of("business", "entertainment", "general", "health", "science", "sports", "technology");

    static final int MAX_ARTICLES = 5;
    static final int DESCRIPTION_CHARS = 150;
    private static final int MIN_DESCRIPTION_CHARS = 10;

    private final NewsClient client;
    private final String defaultCountry;

    public NewsAgentAdapter(final NewsClient client, final String defaultCountry) {
        super(NAME);
        this.client = Objects.requireNonNull(client, "client");
        this.defaultCountry = Objects.requireNonNull(defaultCountry, "defaultCountry").toLowerCase(Locale.ROOT);

        register(LATEST_NEWS, List.of(), this::latest);
    }

    private CompletableFuture<AgentResponse> latest(final Map<String, Object> params, final RoutingMetadata routing) {
        final String category = lowerOrNull(stringParam(params, CATEGORY));
        final String keyword = blankToNull(stringParam(params, KEYWORD));
        final String countryParam = lowerOrNull(stringParam(params, COUNTRY));
        final String country = countryParam == null ? defaultCountry : countryParam;

        if (category == null && keyword == null) {
            return CompletableFuture.completedFuture(AgentResponse.error(
                    "Please specify either a category or keyword to search for news.", routing));
        }
        if (category != null && !CATEGORIES.contains(category)) {
            return CompletableFuture.completedFuture(AgentResponse.error(
                    "Unsupported news category '" + category + "'. Use one of: " + String.join(", ", sorted(CATEGORIES)),
                    routing));
        }

        log.info("Getting news - category: {}, keyword: {}, country: {}", category, keyword, country);
        return client.topHeadlines(category, keyword, country).thenApply(result -> {
            if (result.failed()) {
                log.warn("News lookup failed: {}", result.error());
                return AgentResponse.error("News lookup failed: " + result.error(), routing);
            }
            return AgentResponse.text(format(category, keyword, country, result), routing);
        });
    }

    static String format(final String category, final String keyword, final String country, final NewsResult result) {
        final String region = country.toUpperCase(Locale.ROOT);

        if (result.articles().isEmpty()) {
            final List<String> filters = new ArrayList<>(2);
            if (category != null) filters.add("category '" + category + "'");
            if (keyword != null) filters.add("keyword '" + keyword + "'");
            return "No news articles found for " + String.join(" and ", filters) + " in " + region + ".";
        }

        final String subject;
        if (category != null && keyword != null) {
            subject = "'" + keyword + "' in " + category + " category";
        } else if (category != null) {
            subject = category + " category";
        } else {
            subject = "'" + keyword + "'";
        }

        final StringBuilder sb = new StringBuilder()
                .append("Latest news for ").append(subject).append(" (").append(region).append("):\n\n");
        final List<NewsArticle> shown = result.articles().subList(0, Math.min(MAX_ARTICLES, result.articles().size()));
        for (final NewsArticle article : shown) {
            sb.append("* ").append(article.title() == null ? "No Title" : article.title()).append('\n')
                    .append("   Source: ").append(article.sourceName() == null ? "Unknown Source" : article.sourceName()).append('\n');
            final String description = article.description();
            if (description != null && description.length() > MIN_DESCRIPTION_CHARS) {
                sb.append("   ").append(truncate(description, DESCRIPTION_CHARS)).append('\n');
            }
            sb.append("   ").append(article.url() == null ? "#" : article.url()).append("\n\n");
        }
        return sb.toString().stripTrailing();
    }

    private static List<String> sorted(final Set<String> values) {
        final List<String> list = new ArrayList<>(values);
        list.sort(null);
        return list;
    }

    private static String blankToNull(final String value) {
        return value == null || value.isEmpty() ? null : value;
    }

    private static String lowerOrNull(final String value) {
        final String v = blankToNull(value);
        return v == null ? null : v.toLowerCase(Locale.ROOT);
    }
}
