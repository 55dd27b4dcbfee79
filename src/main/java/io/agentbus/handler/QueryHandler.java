package io.agentbus.handler;

import io.agentbus.broker.MessageBroker;
import io.agentbus.broker.subscriber.Subscriber;
import io.agentbus.config.impl.BusConfig;
import io.agentbus.core.model.Message;
import io.agentbus.core.model.Topics;
import io.agentbus.handler.model.QueryResponse;
import io.agentbus.handler.model.QueryStatus;
import io.agentbus.handler.model.UserQuery;
import io.agentbus.handler.responder.Responder;
import io.agentbus.handler.task.QueryTask;
import io.netty.util.concurrent.EventExecutor;
import io.netty.util.concurrent.ScheduledFuture;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * Subscribes to {@link Topics#USER_QUERY} and answers every query on {@link Topics#QUERY_RESPONSE}.
 * <p>
 * Each accepted query becomes a {@link QueryTask} scheduled on the event loop after a simulated
 * processing delay. Every accepted query gets exactly one response, {@code completed} or
 * {@code error}. {@link #stop()} stops accepting queries and waits for the in-flight ones.
 * </p>
 */
@Slf4j
public final class QueryHandler {

    private final MessageBroker broker;
    private final EventExecutor executor;
    private final Responder responder;

    @Getter private final String agentId;
    private final long minDelayMillis;
    private final long maxDelayMillis;
    private final long drainTimeoutMillis;

    private final Object lifecycleLock = new Object();
    private final Set<QueryTask> inFlight = ConcurrentHashMap.newKeySet();
    private final Subscriber subscriber = this::onUserQuery;
    private volatile boolean running;

    public QueryHandler(final MessageBroker broker,
                        final EventExecutor executor,
                        final Responder responder,
                        final BusConfig config) {
        this.broker = Objects.requireNonNull(broker, "broker");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.responder = Objects.requireNonNull(responder, "responder");
        this.agentId = config.getAgentId();
        this.minDelayMillis = config.getMinDelayMillis();
        this.maxDelayMillis = config.getMaxDelayMillis();
        this.drainTimeoutMillis = config.getDrainTimeoutMillis();
    }

    public void start() {
        synchronized (lifecycleLock) {
            if (running) {
                log.warn("Query handler '{}' is already running", agentId);
                return;
            }
            running = true;
            broker.subscribe(Topics.USER_QUERY, subscriber);
        }
        log.info("Query handler '{}' started and subscribed to {}", agentId, Topics.USER_QUERY);
    }

    /**
     * Unsubscribes, then blocks until every in-flight query has published its response.
     * <p>
     * With a positive drain timeout, queries still running when it expires are cancelled and
     * answered with an error response.
     * </p>
     *
     * @throws IllegalStateException if called from the handler's event loop while it is running
     */
    public void stop() {
        final List<QueryTask> pending;
        synchronized (lifecycleLock) {
            if (!running) return;
            if (executor.inEventLoop()) {
                throw new IllegalStateException("stop() must not be called from the query handler's event loop");
            }
            running = false;
            broker.unsubscribe(Topics.USER_QUERY, subscriber);
            pending = List.copyOf(inFlight);
        }

        if (!pending.isEmpty()) {
            log.info("Waiting for {} processing tasks to complete...", pending.size());
            drain(pending);
        }
        log.info("Query handler '{}' stopped", agentId);
    }

    public boolean isRunning() {
        return running;
    }

    public int inFlight() {
        return inFlight.size();
    }

    private void onUserQuery(final Message message) {
        synchronized (lifecycleLock) {
            if (!running) return;

            final UserQuery query = UserQuery.from(message);
            log.info("Processing query {} from user {}: {}", query.queryId(), query.userId(), query.textContent());

            final QueryTask task = new QueryTask(query, System.currentTimeMillis(), executor.newPromise());
            inFlight.add(task);
            spawn(task);
        }
    }

    private void spawn(final QueryTask task) {
        final ScheduledFuture<?> work;
        try {
            work = executor.schedule(() -> process(task), nextDelayMillis(), TimeUnit.MILLISECONDS);
        } catch (final RejectedExecutionException e) {
            log.error("Event loop rejected query {}", task.getQuery().queryId(), e);
            finish(task, errorResponse(task, "Error processing query: " + e.getMessage()));
            return;
        } catch (final RuntimeException e) {
            log.error("Could not schedule query {}", task.getQuery().queryId(), e);
            finish(task, errorResponse(task, "Error processing query: " + e.getMessage()));
            return;
        }
        task.attach(work);

        // Cancellation (event loop shut down) or anything process() itself could not catch.
        work.addListener(f -> {
            if (f.isSuccess()) return;
            if (f.isCancelled()) {
                finish(task, errorResponse(task, "Query cancelled during shutdown"));
            } else {
                log.error("Processing of query {} terminated abnormally", task.getQuery().queryId(), f.cause());
                finish(task, errorResponse(task, "Error processing query: " + f.cause()));
            }
        });
    }

    private void process(final QueryTask task) {
        final UserQuery query = task.getQuery();
        QueryResponse response;

        try {
            final String text = responder.respond(query.textContent());
            response = new QueryResponse(
                    query.queryId(),
                    query.userId(),
                    text,
                    QueryStatus.COMPLETED,
                    System.currentTimeMillis(),
                    agentId);
        } catch (final Exception e) {
            log.error("Error processing query {}", query.queryId(), e);
            response = errorResponse(task, "Error processing query: " + e.getMessage());
        }

        finish(task, response);
    }

    /* Publishes the terminal response once and retires the task. */
    private void finish(final QueryTask task, final QueryResponse response) {
        if (!task.tryTerminate()) return;

        try {
            broker.publish(response.toMessage());
            if (response.status() == QueryStatus.COMPLETED) {
                log.info("Completed processing query {} in {} ms",
                        response.queryId(), response.timestamp() - task.getAcceptedAt());
            }
        } catch (final Throwable e) {
            log.error("Failed to publish response for query {}", response.queryId(), e);
        } finally {
            inFlight.remove(task);
            task.getCompletion().trySuccess(null);
        }
    }

    private void drain(final List<QueryTask> pending) {
        if (drainTimeoutMillis <= 0) {
            for (final QueryTask task : pending) {
                task.getCompletion().awaitUninterruptibly();
            }
            return;
        }

        final long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(drainTimeoutMillis);
        for (final QueryTask task : pending) {
            final long remaining = deadline - System.nanoTime();
            if (remaining <= 0) break;
            task.getCompletion().awaitUninterruptibly(remaining, TimeUnit.NANOSECONDS);
        }

        int cancelled = 0;
        for (final QueryTask task : pending) {
            if (task.isDone()) continue;
            task.cancelWork();
            finish(task, errorResponse(task, "Query cancelled during shutdown"));
            cancelled++;
        }
        if (cancelled > 0) {
            log.warn("Drain timeout of {} ms expired; cancelled {} queries", drainTimeoutMillis, cancelled);
        }

        // A task that won tryTerminate() concurrently is still publishing.
        for (final QueryTask task : pending) {
            task.getCompletion().awaitUninterruptibly();
        }
    }

    private QueryResponse errorResponse(final QueryTask task, final String text) {
        return new QueryResponse(
                task.getQuery().queryId(),
                task.getQuery().userId(),
                text,
                QueryStatus.ERROR,
                System.currentTimeMillis(),
                agentId);
    }

    private long nextDelayMillis() {
        if (maxDelayMillis <= minDelayMillis) return minDelayMillis;
        final long span = maxDelayMillis - minDelayMillis;
        // span + 1 overflows when the range covers every non-negative long
        final long offset = span == Long.MAX_VALUE
                ? ThreadLocalRandom.current().nextLong(span)
                : ThreadLocalRandom.current().nextLong(span + 1);
        return minDelayMillis + offset;
    }
}
