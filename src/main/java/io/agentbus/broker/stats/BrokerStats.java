package io.agentbus.broker.stats;

import java.util.Map;

/**
 * Point-in-time view of broker activity.
 *
 * @param running           false once the broker has been shut down
 * @param subscribers       topic to current subscriber count
 * @param published         messages accepted by {@code publish}
 * @param delivered         successful subscriber invocations
 * @param failed            subscriber and consumer invocations that threw
 * @param undelivered       messages published to a topic with no subscribers
 * @param consumed          messages taken from topic queues by pull consumers
 * @param dropped           messages not queued because the topic queue was full
 */
public record BrokerStats(boolean running,
                          Map<String, Integer> subscribers,
                          long published,
                          long delivered,
                          long failed,
                          long undelivered,
                          long consumed,
                          long dropped) {

    public int totalSubscribers() {
        return subscribers.values().stream().mapToInt(Integer::intValue).sum();
    }
}
