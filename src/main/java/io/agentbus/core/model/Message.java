package io.agentbus.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable envelope delivered through the broker.
 * <p>
 * The payload is copied on construction and exposed read-only, so a subscriber can never
 * change what the next subscriber sees. Null values are allowed in the payload.
 * </p>
 *
 * @param topic     channel the message is published on
 * @param kind      discriminator of the payload shape within the topic
 * @param payload   topic/kind specific key-value pairs
 * @param timestamp creation time in epoch milliseconds
 */
public record Message(String topic, MessageKind kind, Map<String, Object> payload, long timestamp) {

    public Message {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(kind, "kind");
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public static Message of(final String topic, final MessageKind kind, final Map<String, Object> payload) {
        return new Message(topic, kind, payload, System.currentTimeMillis());
    }

    /**
     * Returns the payload value for {@code key} as a string, or {@code null} when absent.
     */
    public String getString(final String key) {
        final Object v = payload.get(key);
        return v == null ? null : String.valueOf(v);
    }
}
