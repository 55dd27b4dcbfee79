package io.agentbus.agent.model;

public record AgentResponse(MessageRole role, ResponseContent content, RoutingMetadata routing) {

    public static AgentResponse text(final String text, final RoutingMetadata routing) {
        return new AgentResponse(MessageRole.AGENT, new TextContent(text), routing);
    }

    public static AgentResponse error(final String message, final RoutingMetadata routing) {
        return new AgentResponse(MessageRole.AGENT, new ErrorContent(message), routing);
    }

    public boolean isError() {
        return content instanceof ErrorContent;
    }
}
