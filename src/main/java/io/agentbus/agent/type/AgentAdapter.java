package io.agentbus.agent.type;

import io.agentbus.agent.model.AgentRequest;
import io.agentbus.agent.model.AgentResponse;

import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Translates structured function-call requests into collaborator calls and back.
 * <p>
 * The returned future never completes exceptionally: validation failures, collaborator errors and
 * unexpected faults all come back as an error response carrying the request's routing metadata.
 * Adapters keep no state between requests.
 * </p>
 */
public interface AgentAdapter {

    String name();

    Set<String> functions();

    CompletableFuture<AgentResponse> handle(AgentRequest request);
}
