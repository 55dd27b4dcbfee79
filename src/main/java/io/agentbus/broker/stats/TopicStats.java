package io.agentbus.broker.stats;

/**
 * @param queueSize       messages waiting for a pull consumer
 * @param activeConsumers threads currently blocked in {@code consume}/{@code consumeOne} on the topic
 */
public record TopicStats(String topic,
                         int subscribers,
                         int queueSize,
                         int maxQueueSize,
                         int activeConsumers) {

    public boolean queueFull() {
        return queueSize >= maxQueueSize;
    }

    public boolean queueEmpty() {
        return queueSize == 0;
    }
}
