package io.agentbus.handler.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum QueryStatus {
    COMPLETED("completed"),
    ERROR("error");

    private final String wireName;

    public static QueryStatus fromWireName(final String name) {
        for (final QueryStatus s : values()) {
            if (s.wireName.equals(name)) return s;
        }
        throw new IllegalArgumentException("Unknown query status: " + name);
    }
}
