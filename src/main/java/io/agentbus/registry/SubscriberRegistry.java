package io.agentbus.registry;

import io.agentbus.broker.subscriber.Subscriber;

import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of topics and their subscribers.
 * <p>
 * Each topic keeps an insertion-ordered, duplicate-free list. Lists are copy-on-write so a
 * publisher iterates a stable snapshot while subscribers add or remove themselves concurrently.
 * </p>
 */
public final class SubscriberRegistry {
    private final ConcurrentMap<String, CopyOnWriteArrayList<Subscriber>> topics = new ConcurrentHashMap<>();

    public boolean add(final String topic, final Subscriber subscriber) {
        return topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>()).addIfAbsent(subscriber);
    }

    public boolean remove(final String topic, final Subscriber subscriber) {
        final CopyOnWriteArrayList<Subscriber> subs = topics.get(topic);
        return subs != null && subs.remove(subscriber);
    }

    /**
     * Snapshot of the subscribers of {@code topic} in registration order.
     */
    public List<Subscriber> snapshot(final String topic) {
        final CopyOnWriteArrayList<Subscriber> subs = topics.get(topic);
        return subs == null ? List.of() : List.copyOf(subs);
    }

    public int count(final String topic) {
        final CopyOnWriteArrayList<Subscriber> subs = topics.get(topic);
        return subs == null ? 0 : subs.size();
    }

    public boolean contains(final String topic) {
        return topics.containsKey(topic);
    }

    /**
     * Creates an empty entry for {@code topic} if none exists.
     */
    public void addTopic(final String topic) {
        topics.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>());
    }

    /**
     * Drops {@code topic} if it has no subscribers left.
     */
    public boolean removeTopicIfEmpty(final String topic) {
        final boolean existed = topics.containsKey(topic);
        return existed && topics.computeIfPresent(topic, (t, subs) -> subs.isEmpty() ? null : subs) == null;
    }

    public Set<String> listTopics() {
        return Collections.unmodifiableSet(topics.keySet());
    }

    public void clear() {
        topics.clear();
    }
}
