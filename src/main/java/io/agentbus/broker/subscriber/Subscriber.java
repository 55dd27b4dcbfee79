package io.agentbus.broker.subscriber;

import io.agentbus.core.model.Message;

/**
 * Callback registered on a topic.
 * <p>
 * Invoked on the publisher's thread. Implementations that need asynchronous work must schedule it
 * and return; the broker never waits for it.
 * </p>
 */
@FunctionalInterface
public interface Subscriber {
    void onMessage(Message message) throws Exception;
}
