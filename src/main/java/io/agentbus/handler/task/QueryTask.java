package io.agentbus.handler.task;

import io.agentbus.handler.model.UserQuery;
import io.netty.util.concurrent.Future;
import io.netty.util.concurrent.Promise;
import lombok.Getter;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One accepted user query being processed.
 * <p>
 * The query fields are captured when the task is created and never change. {@link #completion()}
 * succeeds once, after the terminal response has been published; {@link #tryTerminate()} decides
 * which path (normal processing or forced cancellation) gets to publish it.
 * </p>
 */
@Getter
public final class QueryTask {
    private final UserQuery query;
    private final long acceptedAt;
    private final Promise<Void> completion;

    private final AtomicBoolean terminated = new AtomicBoolean(false);
    private volatile Future<?> work;

    public QueryTask(final UserQuery query, final long acceptedAt, final Promise<Void> completion) {
        this.query = query;
        this.acceptedAt = acceptedAt;
        this.completion = completion;
    }

    public void attach(final Future<?> work) {
        this.work = work;
    }

    /**
     * @return true for exactly one caller; that caller owns the terminal publish
     */
    public boolean tryTerminate() {
        return terminated.compareAndSet(false, true);
    }

    public boolean isDone() {
        return completion.isDone();
    }

    /**
     * Cancels the scheduled work if it has not started yet.
     */
    public void cancelWork() {
        final Future<?> w = work;
        if (w != null) w.cancel(false);
    }

    @Override
    public String toString() {
        return "QueryTask{queryId=" + query.queryId() + ", userId=" + query.userId() + '}';
    }
}
