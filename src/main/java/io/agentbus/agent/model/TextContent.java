package io.agentbus.agent.model;

public record TextContent(String text) implements ResponseContent {
}
