package com.finopti.observability;

import com.finopti.AppLogger;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Hands events to a delegate on a background thread. When the queue is full
 * the event is dropped; publishing never blocks the caller.
 */
public class AsyncObservabilitySink implements ObservabilitySink {

    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    private final ObservabilitySink delegate;
    private final ThreadPoolExecutor executor;
    private final AtomicLong dropped = new AtomicLong();
    private final AppLogger logger = AppLogger.get();

    public AsyncObservabilitySink(ObservabilitySink delegate, int queueCapacity) {
        if (delegate == null) {
            throw new IllegalArgumentException("delegate sink is required");
        }
        this.delegate = delegate;
        this.executor = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
            new ArrayBlockingQueue<>(Math.max(1, queueCapacity)), sinkThreadFactory(),
            (task, pool) -> dropped.incrementAndGet());
    }

    public AsyncObservabilitySink(ObservabilitySink delegate) {
        this(delegate, DEFAULT_QUEUE_CAPACITY);
    }

    @Override
    public void publish(ObservabilityEvent event) {
        if (event == null) {
            return;
        }
        try {
            executor.execute(() -> deliver(event));
        } catch (RejectedExecutionException e) {
            dropped.incrementAndGet();
        }
    }

    private void deliver(ObservabilityEvent event) {
        try {
            delegate.publish(event);
        } catch (RuntimeException e) {
            logger.warn("Observability sink failed for " + event.getComponent() + "." + event.getEvent()
                + ": " + e.getMessage());
        }
    }

    public long getDroppedCount() {
        return dropped.get();
    }

    /**
     * Stop accepting events and wait briefly for queued ones to drain.
     */
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(2, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static ThreadFactory sinkThreadFactory() {
        return runnable -> {
            Thread thread = new Thread(runnable, "observability-sink");
            thread.setDaemon(true);
            return thread;
        };
    }
}
