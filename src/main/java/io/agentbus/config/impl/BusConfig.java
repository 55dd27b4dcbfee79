package io.agentbus.config.impl;

import lombok.Getter;
import lombok.ToString;
import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.Locale;
import java.util.Map;

/**
 * Immutable config holder loaded from agentbus.yaml
 */
@Getter
@ToString
public final class BusConfig {

    public static final String DEFAULT_AGENT_ID = "query_handler";

    private int brokerMaxQueueSize = 1_000;

    private String agentId = DEFAULT_AGENT_ID;
    private long minDelayMillis = 1_000L;
    private long maxDelayMillis = 1_000L;
    /* 0 waits for in-flight queries without bound */
    private long drainTimeoutMillis = 0L;

    private int searchDefaultMaxResults = 5;
    private int weatherDefaultForecastDays = 3;
    private String newsDefaultCountry = "us";

    public static BusConfig defaults() {
        return new BusConfig();
    }

    public static BusConfig load(final String path) throws IOException {
        try (InputStream in = Files.newInputStream(Paths.get(path))) {
            return load(in);
        }
    }

    public static BusConfig load(final InputStream in) {
        final Object root = new Yaml().load(in);
        if (root == null) return fromMap(Map.of());
        if (!(root instanceof Map<?, ?>)) {
            throw new IllegalArgumentException("configuration root must be a mapping, got " + root.getClass().getSimpleName());
        }
        @SuppressWarnings("unchecked") final Map<String, Object> m = (Map<String, Object>) root;
        return fromMap(m);
    }

    public static BusConfig fromMap(final Map<String, Object> m) {
        final BusConfig cfg = new BusConfig();

        final Map<?, ?> broker = section(m, "broker");
        cfg.brokerMaxQueueSize = intValue(broker, "broker", "maxQueueSize", cfg.brokerMaxQueueSize);

        final Map<?, ?> handler = section(m, "handler");
        cfg.agentId            = stringValue(handler, "handler", "agentId", DEFAULT_AGENT_ID);
        cfg.minDelayMillis     = longValue(handler, "handler", "minDelayMillis", 1_000L);
        cfg.maxDelayMillis     = longValue(handler, "handler", "maxDelayMillis", cfg.minDelayMillis);
        cfg.drainTimeoutMillis = longValue(handler, "handler", "drainTimeoutMillis", 0L);

        cfg.searchDefaultMaxResults = intValue(section(m, "search"), "search", "defaultMaxResults", 5);
        cfg.weatherDefaultForecastDays = intValue(section(m, "weather"), "weather", "defaultForecastDays", 3);
        cfg.newsDefaultCountry = stringValue(section(m, "news"), "news", "defaultCountry", "us").toLowerCase(Locale.ROOT);

        cfg.validate();
        return cfg;
    }

    private static Map<?, ?> section(final Map<String, Object> m, final String name) {
        final Object raw = m.get(name);
        if (raw == null) return Map.of();
        if (raw instanceof Map<?, ?> section) return section;
        throw new IllegalArgumentException(name + " must be a mapping, got " + raw.getClass().getSimpleName());
    }

    private static Number number(final Map<?, ?> section, final String name, final String key, final Number def) {
        final Object raw = section.get(key);
        if (raw == null) return def;
        if (raw instanceof Number n) return n;
        throw new IllegalArgumentException(name + "." + key + " must be a number, got '" + raw + "'");
    }

    private static long longValue(final Map<?, ?> section, final String name, final String key, final long def) {
        return number(section, name, key, def).longValue();
    }

    private static int intValue(final Map<?, ?> section, final String name, final String key, final int def) {
        final long value = number(section, name, key, def).longValue();
        if (value < Integer.MIN_VALUE || value > Integer.MAX_VALUE) {
            throw new IllegalArgumentException(name + "." + key + " is out of range: " + value);
        }
        return (int) value;
    }

    private static String stringValue(final Map<?, ?> section, final String name, final String key, final String def) {
        final Object raw = section.get(key);
        if (raw == null) return def;
        if (raw instanceof String s) return s;
        throw new IllegalArgumentException(name + "." + key + " must be a string, got '" + raw + "'");
    }

    private void validate() {
        if (brokerMaxQueueSize < 1) throw new IllegalArgumentException("broker.maxQueueSize must be > 0");
        if (agentId.isBlank()) throw new IllegalArgumentException("handler.agentId must not be blank");
        if (minDelayMillis < 0) throw new IllegalArgumentException("handler.minDelayMillis must be >= 0");
        if (maxDelayMillis < minDelayMillis) {
            throw new IllegalArgumentException("handler.maxDelayMillis must be >= minDelayMillis");
        }
        if (drainTimeoutMillis < 0) throw new IllegalArgumentException("handler.drainTimeoutMillis must be >= 0");
        if (searchDefaultMaxResults < 1) throw new IllegalArgumentException("search.defaultMaxResults must be > 0");
        if (weatherDefaultForecastDays < 1) throw new IllegalArgumentException("weather.defaultForecastDays must be > 0");
        if (newsDefaultCountry.isBlank()) throw new IllegalArgumentException("news.defaultCountry must not be blank");
    }
}
