package io.agentbus.agent.client;

/**
 * @param snippet may be null or empty
 */
public record SearchHit(String title, String url, String snippet) {
}
