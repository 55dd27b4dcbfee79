package io.agentbus.agent.model;

/**
 * Author of an {@link AgentResponse}. Adapters always answer as {@link #AGENT}.
 */
public enum MessageRole {
    AGENT
}
