package io.agentbus.registry;

import io.agentbus.agent.client.NewsResult;
import io.agentbus.agent.client.SearchResult;
import io.agentbus.agent.client.WeatherReport;
import io.agentbus.agent.client.WeatherClient;
import io.agentbus.agent.impl.NewsAgentAdapter;
import io.agentbus.agent.impl.SearchAgentAdapter;
import io.agentbus.agent.impl.WeatherAgentAdapter;
import io.agentbus.agent.model.AgentRequest;
import io.agentbus.agent.model.AgentResponse;
import io.agentbus.agent.model.ErrorContent;
import io.agentbus.agent.model.RoutingMetadata;
import io.agentbus.agent.model.TextContent;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

final class AgentRegistryTest {

    private static final RoutingMetadata ROUTING = new RoutingMetadata("console", "m1", "c1");

    private static SearchAgentAdapter search(final String answer) {
        return new SearchAgentAdapter(q -> CompletableFuture.completedFuture(SearchResult.failure(answer)), 5);
    }

    private static WeatherAgentAdapter weather() {
        return new WeatherAgentAdapter(new WeatherClient() {
            @Override
            public CompletableFuture<WeatherReport> currentWeather(final String location) {
                return CompletableFuture.completedFuture(WeatherReport.failure("offline"));
            }

            @Override
            public CompletableFuture<WeatherReport> forecast(final String location, final int days) {
                return CompletableFuture.completedFuture(WeatherReport.failure("offline"));
            }
        }, 3);
    }

    @Test
    void findsAdaptersByNameAndFunction() {
        final AgentRegistry registry = new AgentRegistry();
        final SearchAgentAdapter search = search("x");
        final WeatherAgentAdapter weather = weather();
        registry.register(search);
        registry.register(weather);

        assertSame(search, registry.find("web_search_agent").orElseThrow());
        assertSame(search, registry.findByFunction("search_news").orElseThrow());
        assertSame(weather, registry.findByFunction("get_weather_forecast").orElseThrow());
        assertTrue(registry.findByFunction("get_latest_news").isEmpty());
        assertEquals(List.of(search, weather), registry.adapters());
    }

    @Test
    void registeringTheSameNameReplacesTheAdapter() throws Exception {
        final AgentRegistry registry = new AgentRegistry();
        registry.register(search("first"));
        registry.register(search("second"));

        assertEquals(1, registry.adapters().size());
        final AgentResponse response = registry.dispatch(AgentRequest.of("search_web", Map.of("query", "q"), ROUTING))
                .get(5, TimeUnit.SECONDS);
        assertEquals("Search failed: second", ((ErrorContent) response.content()).message());
    }

    @Test
    void unregisterRemovesOnlyKnownAgents() {
        final AgentRegistry registry = new AgentRegistry();
        registry.register(weather());

        assertTrue(registry.unregister("weather_agent"));
        assertFalse(registry.unregister("weather_agent"));
        assertTrue(registry.findByFunction("get_current_weather").isEmpty());
    }

    @Test
    void dispatchRoutesToTheServingAdapter() throws Exception {
        final AgentRegistry registry = new AgentRegistry();
        registry.register(new NewsAgentAdapter((c, k, country) -> CompletableFuture.completedFuture(NewsResult.of(List.of())), "us"));

        final AgentResponse response = registry.dispatch(AgentRequest.of("get_latest_news", Map.of("keyword", "java"), ROUTING))
                .get(5, TimeUnit.SECONDS);

        assertEquals("No news articles found for keyword 'java' in US.", ((TextContent) response.content()).text());
        assertEquals(ROUTING, response.routing());
    }

    @Test
    void dispatchOfAnUnservedFunctionIsAnErrorResponse() throws Exception {
        final AgentRegistry registry = new AgentRegistry();

        final AgentResponse response = registry.dispatch(AgentRequest.of("translate", Map.of(), ROUTING))
                .get(5, TimeUnit.SECONDS);

        assertEquals("Unknown function: translate", ((ErrorContent) response.content()).message());
        assertEquals(ROUTING, response.routing());
    }
}
