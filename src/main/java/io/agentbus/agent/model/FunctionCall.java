package io.agentbus.agent.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Structured function-call request: {@code {function_name, parameters}}.
 */
public record FunctionCall(String functionName, Map<String, Object> parameters) {

    public FunctionCall {
        Objects.requireNonNull(functionName, "functionName");
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
    }
}
