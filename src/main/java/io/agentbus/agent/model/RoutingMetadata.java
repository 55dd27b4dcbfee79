package io.agentbus.agent.model;

/**
 * Transport-level routing fields, echoed back on every response so the caller can correlate it.
 * Any field may be null.
 */
public record RoutingMetadata(String senderId, String parentMessageId, String conversationId) {

    public static final RoutingMetadata NONE = new RoutingMetadata(null, null, null);
}
