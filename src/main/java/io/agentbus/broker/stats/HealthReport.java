package io.agentbus.broker.stats;

/**
 * Outcome of {@code MessageBroker.healthCheck()}: one push delivery and one pull consumption on a
 * scratch topic.
 */
public record HealthReport(boolean healthy,
                           boolean running,
                           boolean subscribeTestPassed,
                           boolean consumeTestPassed,
                           BrokerStats stats,
                           long timestamp) {
}
