package io.agentbus.config;

import io.agentbus.config.impl.BusConfig;
import io.agentbus.config.type.ConfigLoader;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsAllSectionsFromYaml() throws Exception {
        final Path file = dir.resolve("agentbus.yaml");
        Files.writeString(file, String.join("\n",
                "handler:",
                "  agentId: edge_handler",
                "  minDelayMillis: 10",
                "  maxDelayMillis: 250",
                "  drainTimeoutMillis: 5000",
                "search:",
                "  defaultMaxResults: 3",
                "weather:",
                "  defaultForecastDays: 7",
                "news:",
                "  defaultCountry: GB",
                "broker:",
                "  maxQueueSize: 64",
                ""));

        final BusConfig cfg = ConfigLoader.load(file.toString());

        assertEquals("edge_handler", cfg.getAgentId());
        assertEquals(10, cfg.getMinDelayMillis());
        assertEquals(250, cfg.getMaxDelayMillis());
        assertEquals(5000, cfg.getDrainTimeoutMillis());
        assertEquals(3, cfg.getSearchDefaultMaxResults());
        assertEquals(7, cfg.getWeatherDefaultForecastDays());
        assertEquals("gb", cfg.getNewsDefaultCountry());
        assertEquals(64, cfg.getBrokerMaxQueueSize());
    }

    @Test
    void missingKeysFallBackToDefaults() throws Exception {
        final Path file = dir.resolve("partial.yaml");
        Files.writeString(file, "handler:\n  minDelayMillis: 20\n");

        final BusConfig cfg = ConfigLoader.load(file.toString());

        assertEquals(BusConfig.DEFAULT_AGENT_ID, cfg.getAgentId());
        assertEquals(20, cfg.getMinDelayMillis());
        assertEquals(20, cfg.getMaxDelayMillis());
        assertEquals(0, cfg.getDrainTimeoutMillis());
        assertEquals(5, cfg.getSearchDefaultMaxResults());
    }

    @Test
    void emptyFileYieldsDefaults() throws Exception {
        final Path file = dir.resolve("empty.yaml");
        Files.writeString(file, "");

        final BusConfig cfg = ConfigLoader.load(file.toString());

        assertEquals(1_000, cfg.getMinDelayMillis());
        assertEquals(3, cfg.getWeatherDefaultForecastDays());
    }

    @Test
    void bundledResourceLoads() throws Exception {
        final BusConfig cfg = ConfigLoader.loadDefault();
        assertEquals("query_handler", cfg.getAgentId());
        assertEquals(0, cfg.getDrainTimeoutMillis());
    }

    @Test
    void rejectsInvalidDelays() {
        assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(
                Map.of("handler", Map.of("minDelayMillis", 100, "maxDelayMillis", 10))));
        assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(
                Map.of("handler", Map.of("drainTimeoutMillis", -1))));
        assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(
                Map.of("search", Map.of("defaultMaxResults", 0))));
    }

    @Test
    void wronglyTypedValuesAreRejectedAsIllegalArguments() throws Exception {
        final Path numericId = dir.resolve("numeric-id.yaml");
        Files.writeString(numericId, "handler:\n  agentId: 123\n");
        final IllegalArgumentException e1 = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.load(numericId.toString()));
        assertTrue(e1.getMessage().contains("handler.agentId"), e1.getMessage());

        final Path textDelay = dir.resolve("text-delay.yaml");
        Files.writeString(textDelay, "handler:\n  minDelayMillis: \"x\"\n");
        final IllegalArgumentException e2 = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.load(textDelay.toString()));
        assertTrue(e2.getMessage().contains("handler.minDelayMillis"), e2.getMessage());

        final Path scalarSection = dir.resolve("scalar-section.yaml");
        Files.writeString(scalarSection, "search: 5\n");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(scalarSection.toString()));

        final Path listRoot = dir.resolve("list-root.yaml");
        Files.writeString(listRoot, "- a\n- b\n");
        assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(listRoot.toString()));
    }

    @Test
    void outOfRangeIntegersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(
                Map.of("search", Map.of("defaultMaxResults", 10_000_000_000L))));
        assertThrows(IllegalArgumentException.class, () -> BusConfig.fromMap(
                Map.of("broker", Map.of("maxQueueSize", 0))));
    }
}
