package io.agentbus.agent.model;

/**
 * Human-readable failure detail returned instead of a fault.
 */
public record ErrorContent(String message) implements ResponseContent {
}
