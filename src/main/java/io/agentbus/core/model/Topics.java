package io.agentbus.core.model;

import lombok.experimental.UtilityClass;

import java.util.List;

/**
 * Topic names shared by producers and consumers outside the core.
 */
@UtilityClass
public final class Topics {
    public static final String USER_QUERY = "user_query";
    public static final String QUERY_RESPONSE = "query_response";
    public static final String SYSTEM_STATUS = "system_status";
    public static final String AGENT_STATUS = "agent_status";
    public static final String HEARTBEAT = "heartbeat";

    public static final List<String> STANDARD = List.of(USER_QUERY, QUERY_RESPONSE, SYSTEM_STATUS, AGENT_STATUS, HEARTBEAT);
}
