package io.agentbus.agent.client;

/**
 * @param sourceName  publisher name, may be null
 * @param description may be null or empty
 */
public record NewsArticle(String title, String sourceName, String url, String description) {
}
