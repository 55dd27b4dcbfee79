package io.agentbus.handler.responder;

import lombok.Getter;

import java.util.List;

/**
 * Keyword categories checked in declaration order; {@link #GENERAL} matches everything.
 */
@Getter
public enum ResponseCategory {
    WEATHER(List.of("weather", "temperature", "rain", "sunny", "cloudy")),
    DATA_ANALYSIS(List.of("data", "analysis", "analytics", "statistics", "chart")),
    CODING(List.of("code", "program", "python", "javascript", "api")),
    SYSTEM_STATUS(List.of("status", "health", "system")),
    GENERAL(List.of());

    private final List<String> keywords;

    ResponseCategory(final List<String> keywords) {
        this.keywords = keywords;
    }

    boolean matches(final String normalized) {
        if (keywords.isEmpty()) return true;
        for (final String k : keywords) {
            if (normalized.contains(k)) return true;
        }
        return false;
    }
}
