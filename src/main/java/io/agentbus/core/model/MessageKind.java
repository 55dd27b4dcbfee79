package io.agentbus.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum MessageKind {
    USER_QUERY("user_query"),
    QUERY_RESPONSE("query_response"),
    ERROR("error"),
    AGENT_STATUS("agent_status"),
    HEARTBEAT("heartbeat");

    private final String wireName;

    public static MessageKind fromWireName(final String name) {
        for (final MessageKind k : values()) {
            if (k.wireName.equals(name)) return k;
        }
        throw new IllegalArgumentException("Unknown message kind: " + name);
    }
}
