package io.agentbus.agent.model;

/**
 * Body of an {@link AgentResponse}: either {@link TextContent} or {@link ErrorContent}.
 */
public interface ResponseContent {
}
