package io.agentbus.agent.model;

import java.util.Map;
import java.util.Objects;

public record AgentRequest(FunctionCall call, RoutingMetadata routing) {

    public AgentRequest {
        Objects.requireNonNull(call, "call");
        if (routing == null) routing = RoutingMetadata.NONE;
    }

    public static AgentRequest of(final String functionName,
                                  final Map<String, Object> parameters,
                                  final RoutingMetadata routing) {
        return new AgentRequest(new FunctionCall(functionName, parameters), routing);
    }

    public String functionName() {
        return call.functionName();
    }

    public Map<String, Object> parameters() {
        return call.parameters();
    }
}
