package io.agentbus.handler.model;

import io.agentbus.core.model.Message;
import io.agentbus.core.model.MessageKind;
import io.agentbus.core.model.Topics;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed view of a {@code user_query} payload.
 */
public record UserQuery(String queryId, String userId, String textContent) {

    public static final String QUERY_ID = "query_id";
    public static final String USER_ID = "user_id";
    public static final String TEXT_CONTENT = "text_content";

    public UserQuery {
        if (textContent == null) textContent = "";
    }

    public static UserQuery from(final Message message) {
        return new UserQuery(
                message.getString(QUERY_ID),
                message.getString(USER_ID),
                message.getString(TEXT_CONTENT));
    }

    public Map<String, Object> toPayload() {
        final Map<String, Object> m = new LinkedHashMap<>();
        m.put(QUERY_ID, queryId);
        m.put(USER_ID, userId);
        m.put(TEXT_CONTENT, textContent);
        return m;
    }

    public Message toMessage() {
        return Message.of(Topics.USER_QUERY, MessageKind.USER_QUERY, toPayload());
    }
}
