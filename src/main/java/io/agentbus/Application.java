package io.agentbus;

import io.agentbus.agent.client.NewsClient;
import io.agentbus.agent.client.NewsResult;
import io.agentbus.agent.client.SearchClient;
import io.agentbus.agent.client.SearchResult;
import io.agentbus.agent.client.WeatherClient;
import io.agentbus.agent.client.WeatherReport;
import io.agentbus.agent.impl.NewsAgentAdapter;
import io.agentbus.agent.impl.SearchAgentAdapter;
import io.agentbus.agent.impl.WeatherAgentAdapter;
import io.agentbus.agent.model.AgentRequest;
import io.agentbus.agent.model.ErrorContent;
import io.agentbus.agent.model.RoutingMetadata;
import io.agentbus.agent.model.TextContent;
import io.agentbus.broker.MessageBroker;
import io.agentbus.broker.stats.HealthReport;
import io.agentbus.config.impl.BusConfig;
import io.agentbus.config.type.ConfigLoader;
import io.agentbus.core.model.Topics;
import io.agentbus.handler.QueryHandler;
import io.agentbus.handler.model.QueryResponse;
import io.agentbus.handler.model.UserQuery;
import io.agentbus.handler.responder.KeywordResponder;
import io.agentbus.registry.AgentRegistry;
import io.netty.channel.DefaultEventLoop;
import io.netty.util.concurrent.DefaultThreadFactory;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

/**
 * Starts a broker and query handler on a single event loop and feeds it queries typed on stdin.
 * <p>
 * Lines starting with {@code !} are agent function calls, e.g.
 * {@code !search_web query=netty event loop max_results=3}; every other line is a user query.
 * </p>
 */
@Slf4j
public class Application {
    static final char CALL_PREFIX = '!';

    public static void main(final String[] args) throws Exception {
        final BusConfig cfg = args.length > 0 ? ConfigLoader.load(args[0]) : ConfigLoader.loadDefault();
        log.info("Loaded configuration: {}", cfg);

        final DefaultEventLoop eventLoop = new DefaultEventLoop(new DefaultThreadFactory("agentbus-loop", true));
        final MessageBroker broker = new MessageBroker(cfg.getBrokerMaxQueueSize());
        final QueryHandler handler = new QueryHandler(broker, eventLoop, new KeywordResponder(), cfg);
        final AgentRegistry agents = agents(cfg);

        final HealthReport health = broker.healthCheck();
        log.info("Broker health check: healthy={}", health.healthy());

        broker.subscribe(Topics.QUERY_RESPONSE, message -> {
            final QueryResponse r = QueryResponse.from(message);
            log.info("[{}] {} -> {}", r.status().getWireName(), r.queryId(), r.response());
        });
        handler.start();

        /* Drain in-flight queries before the event loop goes away */
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down AgentBus...");
                handler.stop();
                broker.shutdown();
                eventLoop.shutdownGracefully().syncUninterruptibly();
                log.info("Shutdown complete.");
            } catch (final Exception e) {
                log.error("Error during shutdown", e);
            }
        }));

        log.info("AgentBus started as '{}'. Type a query per line, {}<function> key=value... for agents, EOF to exit.",
                handler.getAgentId(), CALL_PREFIX);

        try (final BufferedReader in = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8))) {
            String line;
            while ((line = in.readLine()) != null) {
                if (!line.isEmpty() && line.charAt(0) == CALL_PREFIX) {
                    agents.dispatch(parseCall(line, "console")).thenAccept(response -> {
                        if (response.content() instanceof TextContent text) {
                            log.info("{}", text.text());
                        } else if (response.content() instanceof ErrorContent error) {
                            log.warn("{}", error.message());
                        }
                    });
                } else {
                    broker.publish(new UserQuery(UUID.randomUUID().toString(), "console", line).toMessage());
                }
            }
        }
    }

    /*
     * Adapters are registered with collaborators that report themselves unavailable; a deployment
     * supplies HTTP-backed clients instead.
     */
    static AgentRegistry agents(final BusConfig cfg) {
        final SearchClient search = query -> CompletableFuture.completedFuture(
                SearchResult.failure("search backend not configured"));
        final NewsClient news = (category, keyword, country) -> CompletableFuture.completedFuture(
                NewsResult.failure("news backend not configured"));
        final WeatherClient weather = new WeatherClient() {
            @Override
            public CompletableFuture<WeatherReport> currentWeather(final String location) {
                return CompletableFuture.completedFuture(WeatherReport.failure("weather backend not configured"));
            }

            @Override
            public CompletableFuture<WeatherReport> forecast(final String location, final int days) {
                return CompletableFuture.completedFuture(WeatherReport.failure("weather backend not configured"));
            }
        };

        final AgentRegistry registry = new AgentRegistry();
        registry.register(new SearchAgentAdapter(search, cfg.getSearchDefaultMaxResults()));
        registry.register(new WeatherAgentAdapter(weather, cfg.getWeatherDefaultForecastDays()));
        registry.register(new NewsAgentAdapter(news, cfg.getNewsDefaultCountry()));
        return registry;
    }

    /**
     * Parses {@code !function key=value ...}. A word without {@code =} continues the previous value,
     * so {@code query=netty event loop} is one parameter.
     */
    static AgentRequest parseCall(final String line, final String senderId) {
        final String[] words = line.substring(1).strip().split("\\s+");
        final Map<String, Object> params = new LinkedHashMap<>();

        String key = null;
        for (int i = 1; i < words.length; i++) {
            final int eq = words[i].indexOf('=');
            if (eq > 0) {
                key = words[i].substring(0, eq);
                params.put(key, words[i].substring(eq + 1));
            } else if (key != null) {
                params.put(key, params.get(key) + " " + words[i]);
            }
        }
        return AgentRequest.of(words[0], params,
                new RoutingMetadata(senderId, UUID.randomUUID().toString(), null));
    }
}
