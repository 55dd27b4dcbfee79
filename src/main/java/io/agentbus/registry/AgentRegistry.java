package io.agentbus.registry;

import io.agentbus.agent.model.AgentRequest;
import io.agentbus.agent.model.AgentResponse;
import io.agentbus.agent.type.AgentAdapter;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Running agent adapters by name, with lookup by the function names they serve.
 * <p>
 * Registering a second adapter under a known name replaces the first. When two adapters serve
 * the same function, the one registered first wins.
 * </p>
 */
@Slf4j
public final class AgentRegistry {
    private final Map<String, AgentAdapter> adapters = new LinkedHashMap<>();

    public synchronized void register(final AgentAdapter adapter) {
        Objects.requireNonNull(adapter, "adapter");

        final AgentAdapter previous = adapters.put(adapter.name(), adapter);
        if (previous != null) {
            log.warn("Agent '{}' already registered. Updating.", adapter.name());
        }
        for (final String fn : adapter.functions()) {
            final AgentAdapter owner = owner(fn);
            if (owner != adapter) {
                log.warn("Function '{}' of agent '{}' is already served by '{}'", fn, adapter.name(), owner.name());
            }
        }
        log.info("Registered agent '{}' with functions {}", adapter.name(), adapter.functions());
    }

    public synchronized boolean unregister(final String name) {
        if (adapters.remove(name) == null) {
            log.warn("Attempted to unregister unknown agent '{}'", name);
            return false;
        }
        log.info("Unregistered agent '{}'", name);
        return true;
    }

    public synchronized Optional<AgentAdapter> find(final String name) {
        return Optional.ofNullable(adapters.get(name));
    }

    public synchronized Optional<AgentAdapter> findByFunction(final String functionName) {
        return Optional.ofNullable(owner(functionName));
    }

    public synchronized List<AgentAdapter> adapters() {
        return List.copyOf(adapters.values());
    }

    /**
     * Routes {@code request} to the adapter serving its function. Like the adapters themselves, the
     * returned future never completes exceptionally.
     */
    public CompletableFuture<AgentResponse> dispatch(final AgentRequest request) {
        final Optional<AgentAdapter> adapter = findByFunction(request.functionName());
        if (adapter.isEmpty()) {
            log.warn("No agent serves function '{}'", request.functionName());
            return CompletableFuture.completedFuture(
                    AgentResponse.error("Unknown function: " + request.functionName(), request.routing()));
        }
        return adapter.get().handle(request);
    }

    private AgentAdapter owner(final String functionName) {
        for (final AgentAdapter a : adapters.values()) {
            if (a.functions().contains(functionName)) return a;
        }
        return null;
    }
}
