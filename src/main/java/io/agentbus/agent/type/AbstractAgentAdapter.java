package io.agentbus.agent.type;

import io.agentbus.agent.model.AgentRequest;
import io.agentbus.agent.model.AgentResponse;
import io.agentbus.agent.model.RoutingMetadata;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Dispatches requests by function name, checks required parameters and turns every failure into
 * an error response. Subclasses register their functions in the constructor.
 */
@Slf4j
public abstract class AbstractAgentAdapter implements AgentAdapter {

    private final String name;
    private final Map<String, AgentFunction> functions = new LinkedHashMap<>();

    protected AbstractAgentAdapter(final String name) {
        this.name = Objects.requireNonNull(name, "name");
    }

    @FunctionalInterface
    protected interface FunctionHandler {
        CompletableFuture<AgentResponse> apply(Map<String, Object> parameters, RoutingMetadata routing) throws Exception;
    }

    private record AgentFunction(String name, List<String> required, FunctionHandler handler) {
    }

    protected final void register(final String functionName, final List<String> required, final FunctionHandler handler) {
        if (functions.putIfAbsent(functionName, new AgentFunction(functionName, List.copyOf(required), handler)) != null) {
            throw new IllegalArgumentException("Function already registered: " + functionName);
        }
    }

    @Override
    public final String name() {
        return name;
    }

    @Override
    public final Set<String> functions() {
        return Collections.unmodifiableSet(functions.keySet());
    }

    @Override
    public final CompletableFuture<AgentResponse> handle(final AgentRequest request) {
        final String fn = request.functionName();
        final RoutingMetadata routing = request.routing();
        log.info("[{}] Function call '{}' from {} (parent: {}, conversation: {})",
                name, fn, routing.senderId(), routing.parentMessageId(), routing.conversationId());

        final AgentFunction function = functions.get(fn);
        if (function == null) {
            log.warn("[{}] Unknown function '{}'", name, fn);
            return CompletableFuture.completedFuture(AgentResponse.error("Unknown function: " + fn, routing));
        }

        for (final String param : function.required()) {
            if (!isPresent(request.parameters().get(param))) {
                log.warn("[{}] Function '{}' called without required parameter '{}'", name, fn, param);
                return CompletableFuture.completedFuture(AgentResponse.error(
                        "Missing required parameter '" + param + "' for function '" + fn + "'", routing));
            }
        }

        final CompletableFuture<AgentResponse> result;
        try {
            result = Objects.requireNonNull(function.handler().apply(request.parameters(), routing),
                    "handler returned no result");
        } catch (final Exception e) {
            return CompletableFuture.completedFuture(fault(fn, routing, e));
        }

        return result.handle((response, ex) -> {
            if (ex != null) return fault(fn, routing, unwrap(ex));
            if (response == null) return fault(fn, routing, new IllegalStateException("empty response"));
            return response;
        });
    }

    private AgentResponse fault(final String fn, final RoutingMetadata routing, final Throwable cause) {
        log.error("[{}] Error executing '{}' for sender {} (parent: {})",
                name, fn, routing.senderId(), routing.parentMessageId(), cause);
        return AgentResponse.error("Error executing " + fn + ": " + cause.getMessage(), routing);
    }

    private static Throwable unwrap(final Throwable ex) {
        Throwable t = ex;
        while ((t instanceof CompletionException || t instanceof ExecutionException) && t.getCause() != null) {
            t = t.getCause();
        }
        return t;
    }

    private static boolean isPresent(final Object value) {
        if (value == null) return false;
        return !(value instanceof String s) || !s.isBlank();
    }

    /**
     * Reads an integer parameter, clamped to {@code [min, max]}; absent means {@code defaultValue}.
     *
     * @throws IllegalArgumentException if the value is not a number
     */
    protected static int intParam(final Map<String, Object> parameters,
                                  final String key,
                                  final int defaultValue,
                                  final int min,
                                  final int max) {
        final Object raw = parameters.get(key);
        final int value;
        if (raw == null) {
            value = defaultValue;
        } else if (raw instanceof Number n) {
            value = n.intValue();
        } else {
            try {
                value = Integer.parseInt(String.valueOf(raw).strip());
            } catch (final NumberFormatException e) {
                throw new IllegalArgumentException("Parameter '" + key + "' must be an integer, got '" + raw + "'", e);
            }
        }
        return Math.min(Math.max(value, min), max);
    }

    protected static String stringParam(final Map<String, Object> parameters, final String key) {
        final Object raw = parameters.get(key);
        return raw == null ? null : String.valueOf(raw).strip();
    }

    protected static String truncate(final String text, final int maxChars) {
        if (text == null || text.length() <= maxChars) return text;
        return text.substring(0, maxChars) + "...";
    }
}
