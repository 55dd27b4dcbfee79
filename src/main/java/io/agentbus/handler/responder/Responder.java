package io.agentbus.handler.responder;

/**
 * Turns the text of a user query into response text.
 * <p>
 * Implementations may throw; the query handler converts the failure into an error response.
 * </p>
 */
@FunctionalInterface
public interface Responder {
    String respond(String text) throws Exception;
}
