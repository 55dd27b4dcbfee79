package io.agentbus.handler.model;

import io.agentbus.core.model.Message;
import io.agentbus.core.model.MessageKind;
import io.agentbus.core.model.Topics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of a {@code query_response} payload.
 *
 * @param timestamp epoch milliseconds at which the response was produced
 */
public record QueryResponse(String queryId,
                            String userId,
                            String response,
                            QueryStatus status,
                            long timestamp,
                            String processingAgent) {

    public static final String QUERY_ID = "query_id";
    public static final String USER_ID = "user_id";
    public static final String RESPONSE = "response";
    public static final String STATUS = "status";
    public static final String TIMESTAMP = "timestamp";
    public static final String PROCESSING_AGENT = "processing_agent";

    public static QueryResponse from(final Message message) {
        final Object ts = message.payload().get(TIMESTAMP);
        return new QueryResponse(
                message.getString(QUERY_ID),
                message.getString(USER_ID),
                message.getString(RESPONSE),
                QueryStatus.fromWireName(message.getString(STATUS)),
                ts instanceof Number n ? n.longValue() : 0L,
                message.getString(PROCESSING_AGENT));
    }

    public Map<String, Object> toPayload() {
        final Map<String, Object> m = new LinkedHashMap<>();
        m.put(QUERY_ID, queryId);
        m.put(USER_ID, userId);
        m.put(RESPONSE, response);
        m.put(STATUS, status.getWireName());
        m.put(TIMESTAMP, timestamp);
        m.put(PROCESSING_AGENT, processingAgent);
        return m;
    }

    /**
     * Error responses travel as {@link MessageKind#ERROR} on the same topic as completed ones.
     */
    public Message toMessage() {
        final MessageKind kind = status == QueryStatus.COMPLETED ? MessageKind.QUERY_RESPONSE : MessageKind.ERROR;
        return new Message(Topics.QUERY_RESPONSE, kind, toPayload(), timestamp);
    }
}
