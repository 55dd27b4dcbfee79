package io.agentbus.broker;

import io.agentbus.broker.stats.BrokerStats;
import io.agentbus.broker.stats.HealthReport;
import io.agentbus.broker.stats.TopicStats;
import io.agentbus.broker.subscriber.Subscriber;
import io.agentbus.core.model.Message;
import io.agentbus.core.model.MessageKind;
import io.agentbus.core.model.Topics;
import io.agentbus.registry.SubscriberRegistry;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

/**
 * In-process topic broker.
 * <p>
 * {@link #publish(Message)} invokes every subscriber registered on the topic at the moment of
 * delivery, in registration order, on the calling thread. A subscriber that throws is logged and
 * skipped; it never stops delivery to the others and never reaches the publisher.
 * </p>
 * <p>
 * Every published message is also offered to a bounded per-topic queue that pull consumers drain
 * with {@link #consumeOne} and {@link #consume}. When the queue is full the message still reaches
 * the subscribers but is not queued.
 * </p>
 * <p>
 * Instances are independent. {@link #shared()} offers a process-wide default for wiring code,
 * nothing in the core depends on it.
 * </p>
 */
@Slf4j
public final class MessageBroker implements AutoCloseable {

    public static final int DEFAULT_MAX_QUEUE_SIZE = 1_000;
    static final String HEALTH_CHECK_TOPIC = "health_check_test";

    /* consumers re-check the running flag at least this often while blocked */
    private static final long POLL_SLICE_NANOS = TimeUnit.MILLISECONDS.toNanos(100);

    private final SubscriberRegistry registry = new SubscriberRegistry();
    private final ConcurrentMap<String, TopicQueue> queues = new ConcurrentHashMap<>();
    private final int maxQueueSize;
    private final AtomicBoolean running = new AtomicBoolean(true);

    private final LongAdder published = new LongAdder();
    private final LongAdder delivered = new LongAdder();
    private final LongAdder failed = new LongAdder();
    private final LongAdder undelivered = new LongAdder();
    private final LongAdder consumed = new LongAdder();
    private final LongAdder dropped = new LongAdder();

    public MessageBroker() {
        this(DEFAULT_MAX_QUEUE_SIZE);
    }

    public MessageBroker(final int maxQueueSize) {
        if (maxQueueSize < 1) throw new IllegalArgumentException("maxQueueSize must be > 0");
        this.maxQueueSize = maxQueueSize;
        Topics.STANDARD.forEach(registry::addTopic);
    }

    public static MessageBroker shared() {
        return Holder.INSTANCE;
    }

    /**
     * Registers {@code subscriber} for every later publish to {@code topic}.
     *
     * @return false if it is already subscribed to the topic or the broker is shut down
     */
    public boolean subscribe(final String topic, final Subscriber subscriber) {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(subscriber, "subscriber");

        if (!running.get()) {
            log.warn("Cannot subscribe to '{}': broker is shut down", topic);
            return false;
        }

        final boolean added = registry.add(topic, subscriber);
        if (added) {
            log.info("Subscribed to topic '{}'. Total subscribers: {}", topic, registry.count(topic));
        } else {
            log.warn("Subscriber already registered on topic '{}'", topic);
        }
        return added;
    }

    /**
     * Removes {@code subscriber} from {@code topic}. Unknown topics or subscribers are a no-op.
     */
    public boolean unsubscribe(final String topic, final Subscriber subscriber) {
        if (topic == null || subscriber == null) return false;

        final boolean removed = registry.remove(topic, subscriber);
        if (removed) {
            log.info("Unsubscribed from topic '{}'. Remaining subscribers: {}", topic, registry.count(topic));
        } else {
            log.debug("Subscriber not registered on topic '{}'", topic);
        }
        return removed;
    }

    public int publish(final String topic, final MessageKind kind, final Map<String, Object> payload) {
        return publish(Message.of(topic, kind, payload));
    }

    /**
     * Delivers {@code message} to the current subscribers of its topic and queues it for pull consumers.
     *
     * @return number of subscribers that handled the message without throwing
     */
    public int publish(final Message message) {
        Objects.requireNonNull(message, "message");
        final String topic = message.topic();

        if (!running.get()) {
            log.error("Cannot publish to '{}': broker is shut down", topic);
            return 0;
        }

        published.increment();
        enqueue(message);

        final List<Subscriber> subscribers = registry.snapshot(topic);
        if (subscribers.isEmpty()) {
            undelivered.increment();
            log.debug("No subscribers for topic '{}'; {} message left for pull consumers", topic, message.kind());
            return 0;
        }

        int ok = 0;
        for (final Subscriber subscriber : subscribers) {
            if (deliver(subscriber, message)) ok++;
        }
        delivered.add(ok);

        if (ok < subscribers.size()) {
            log.warn("Topic '{}': {} successful, {} failed subscriber calls", topic, ok, subscribers.size() - ok);
        }
        return ok;
    }

    /**
     * Takes the oldest queued message of {@code topic}, waiting up to {@code timeout}.
     *
     * @return empty on timeout or once the broker is shut down
     */
    public Optional<Message> consumeOne(final String topic, final long timeout, final TimeUnit unit)
            throws InterruptedException {
        Objects.requireNonNull(topic, "topic");
        if (!running.get()) {
            log.error("Cannot consume from '{}': broker is shut down", topic);
            return Optional.empty();
        }

        final TopicQueue queue = queue(topic);
        queue.consumers.incrementAndGet();
        try {
            final Message message = poll(queue, unit.toNanos(timeout));
            if (message == null) {
                log.debug("No message available on topic '{}' within {} {}", topic, timeout, unit);
                return Optional.empty();
            }
            consumed.increment();
            return Optional.of(message);
        } finally {
            queue.consumers.decrementAndGet();
        }
    }

    /**
     * Hands queued messages of {@code topic} to {@code consumer} on the calling thread until none
     * arrives within {@code idleTimeout} or the broker shuts down. A consumer that throws is logged
     * and counted; consumption continues with the next message.
     *
     * @return number of messages taken from the queue
     */
    public int consume(final String topic,
                       final long idleTimeout,
                       final TimeUnit unit,
                       final Subscriber consumer) throws InterruptedException {
        Objects.requireNonNull(consumer, "consumer");
        log.info("Started consuming messages from topic '{}'", topic);

        int count = 0;
        try {
            Optional<Message> next;
            while ((next = consumeOne(topic, idleTimeout, unit)).isPresent()) {
                count++;
                deliver(consumer, next.get());
            }
        } finally {
            log.info("Stopped consuming messages from topic '{}' after {} messages", topic, count);
        }
        return count;
    }

    public Set<String> topics() {
        return registry.listTopics();
    }

    public int subscriberCount(final String topic) {
        return registry.count(topic);
    }

    public boolean isRunning() {
        return running.get();
    }

    public BrokerStats stats() {
        final Map<String, Integer> counts = new LinkedHashMap<>();
        for (final String topic : registry.listTopics()) {
            counts.put(topic, registry.count(topic));
        }
        return new BrokerStats(
                running.get(),
                Map.copyOf(counts),
                published.sum(),
                delivered.sum(),
                failed.sum(),
                undelivered.sum(),
                consumed.sum(),
                dropped.sum());
    }

    /**
     * @return empty if the topic has never been subscribed to, published to or consumed from
     */
    public Optional<TopicStats> topicStats(final String topic) {
        final TopicQueue queue = queues.get(topic);
        if (queue == null && !registry.contains(topic)) return Optional.empty();

        return Optional.of(new TopicStats(
                topic,
                registry.count(topic),
                queue == null ? 0 : queue.messages.size(),
                maxQueueSize,
                queue == null ? 0 : queue.consumers.get()));
    }

    /**
     * Round-trips one message through a subscriber and one through the pull queue on a scratch
     * topic, then removes the topic again. Blocks for up to a second.
     */
    public HealthReport healthCheck() throws InterruptedException {
        final AtomicInteger received = new AtomicInteger();
        final Subscriber checker = m -> received.incrementAndGet();

        boolean consumeOk = false;
        subscribe(HEALTH_CHECK_TOPIC, checker);
        try {
            publish(HEALTH_CHECK_TOPIC, MessageKind.HEARTBEAT, Map.of("test", true));
            consumeOk = consumeOne(HEALTH_CHECK_TOPIC, 1, TimeUnit.SECONDS).isPresent();
        } finally {
            unsubscribe(HEALTH_CHECK_TOPIC, checker);
            queues.remove(HEALTH_CHECK_TOPIC);
            registry.removeTopicIfEmpty(HEALTH_CHECK_TOPIC);
        }

        final boolean subscribeOk = received.get() > 0;
        final boolean healthy = running.get() && subscribeOk && consumeOk;
        if (!healthy) {
            log.warn("Broker health check failed (running={}, subscribe={}, consume={})",
                    running.get(), subscribeOk, consumeOk);
        }
        return new HealthReport(healthy, running.get(), subscribeOk, consumeOk, stats(), System.currentTimeMillis());
    }

    /**
     * Drops every subscription and queued message and rejects later subscribe/publish/consume calls.
     */
    public void shutdown() {
        if (!running.compareAndSet(true, false)) return;
        registry.clear();
        queues.clear();
        log.info("Message broker stopped");
    }

    @Override
    public void close() {
        shutdown();
    }

    private boolean deliver(final Subscriber subscriber, final Message message) {
        try {
            subscriber.onMessage(message);
            return true;
        } catch (final Throwable t) {
            if (t instanceof InterruptedException) Thread.currentThread().interrupt();
            failed.increment();
            log.error("Subscriber on topic '{}' failed for {} message", message.topic(), message.kind(), t);
            return false;
        }
    }

    private void enqueue(final Message message) {
        if (!queue(message.topic()).messages.offer(message)) {
            dropped.increment();
            log.debug("Queue for topic '{}' is full ({}); message not queued", message.topic(), maxQueueSize);
        }
    }

    private Message poll(final TopicQueue queue, final long timeoutNanos) throws InterruptedException {
        final long deadline = System.nanoTime() + timeoutNanos;
        long remaining = timeoutNanos;
        while (running.get()) {
            final Message message = queue.messages.poll(Math.max(0, Math.min(remaining, POLL_SLICE_NANOS)), TimeUnit.NANOSECONDS);
            if (message != null) return message;
            remaining = deadline - System.nanoTime();
            if (remaining <= 0) return null;
        }
        return null;
    }

    private TopicQueue queue(final String topic) {
        return queues.computeIfAbsent(topic, t -> new TopicQueue(new ArrayBlockingQueue<>(maxQueueSize)));
    }

    private record TopicQueue(BlockingQueue<Message> messages, AtomicInteger consumers) {
        TopicQueue(final BlockingQueue<Message> messages) {
            this(messages, new AtomicInteger());
        }
    }

    private static final class Holder {
        private static final MessageBroker INSTANCE = new MessageBroker();
    }
}
