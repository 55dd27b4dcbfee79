package io.agentbus;

import io.agentbus.agent.model.AgentRequest;
import io.agentbus.agent.model.AgentResponse;
import io.agentbus.agent.model.ErrorContent;
import io.agentbus.config.impl.BusConfig;
import io.agentbus.registry.AgentRegistry;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class ApplicationTest {

    @Test
    void parsesFunctionCallsWithMultiWordValues() {
        final AgentRequest request = Application.parseCall("!search_web query=netty event loop max_results=3", "console");

        assertEquals("search_web", request.functionName());
        assertEquals(Map.of("query", "netty event loop", "max_results", "3"), request.parameters());
        assertEquals("console", request.routing().senderId());
        assertNotNull(request.routing().parentMessageId());
    }

    @Test
    void callWithoutParameters() {
        final AgentRequest request = Application.parseCall("!get_latest_news", "console");

        assertEquals("get_latest_news", request.functionName());
        assertTrue(request.parameters().isEmpty());
    }

    @Test
    void wiresEveryAdapterWithConfiguredDefaults() throws Exception {
        final AgentRegistry registry = Application.agents(BusConfig.defaults());

        assertEquals(3, registry.adapters().size());
        assertTrue(registry.findByFunction("search_news").isPresent());
        assertTrue(registry.findByFunction("get_weather_forecast").isPresent());
        assertTrue(registry.findByFunction("get_latest_news").isPresent());

        final AgentResponse response = registry.dispatch(Application.parseCall("!get_current_weather location=Paris", "t"))
                .get(5, TimeUnit.SECONDS);
        assertEquals("Weather lookup failed: weather backend not configured", ((ErrorContent) response.content()).message());
    }
}
