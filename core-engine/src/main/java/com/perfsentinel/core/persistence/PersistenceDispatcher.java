package com.perfsentinel.core.persistence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs persistence writes off the ingestion path.
 *
 * <p>
 * Writes are fire-and-forget: {@link #dispatch} returns as soon as the write
 * is queued, and a failing write is logged and counted but never reported to
 * the caller whose transition triggered it. Retrying is the store's concern.
 * </p>
 *
 * <p>
 * Every write carries a routing key. Writes sharing a key always land on the
 * same single-threaded lane, so they run in the order they were dispatched.
 * </p>
 *
 * @since 1.0.0
 */
public class PersistenceDispatcher implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(PersistenceDispatcher.class);

    private final List<Executor> lanes;
    private final AtomicLong failures = new AtomicLong();

    /**
     * Single-lane dispatcher. The executor must run tasks in submission
     * order for writes to one key to stay ordered.
     *
     * @param executor executor that runs the writes; must not be {@code null}
     */
    public PersistenceDispatcher(Executor executor) {
        this(List.of(Objects.requireNonNull(executor, "executor must not be null")));
    }

    private PersistenceDispatcher(List<Executor> lanes) {
        this.lanes = List.copyOf(lanes);
    }

    /**
     * Dispatcher backed by {@code threads} single-threaded daemon lanes.
     *
     * @param threads number of lanes; must be &gt;= 1
     */
    public static PersistenceDispatcher withThreads(int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1, got: " + threads);
        }
        AtomicInteger counter = new AtomicInteger();
        List<Executor> lanes = new ArrayList<>(threads);
        for (int i = 0; i < threads; i++) {
            lanes.add(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "persistence-writer-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            }));
        }
        return new PersistenceDispatcher(lanes);
    }

    /**
     * Queue a write on the lane owned by {@code key}.
     *
     * @param key         routing key, e.g. an alert id; must not be {@code null}
     * @param description what is being written, for the log
     * @param write       the write itself
     */
    public void dispatch(String key, String description, Runnable write) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(write, "write must not be null");
        Executor lane = lanes.get(Math.floorMod(key.hashCode(), lanes.size()));
        try {
            lane.execute(() -> run(description, write));
        } catch (RejectedExecutionException e) {
            failures.incrementAndGet();
            LOG.error("Persistence write rejected: {}", description, e);
        }
    }

    /**
     * @return number of writes that failed or were rejected so far
     */
    public long getFailureCount() {
        return failures.get();
    }

    /**
     * Stop accepting writes and wait briefly for queued ones to finish.
     */
    @Override
    public void close() {
        for (Executor lane : lanes) {
            if (lane instanceof ExecutorService service) {
                service.shutdown();
            }
        }
        for (Executor lane : lanes) {
            if (lane instanceof ExecutorService service) {
                awaitLane(service);
            }
        }
    }

    private void awaitLane(ExecutorService service) {
        try {
            if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                LOG.warn("Persistence writes still pending at shutdown");
                service.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            service.shutdownNow();
        }
    }

    private void run(String description, Runnable write) {
        try {
            write.run();
        } catch (RuntimeException e) {
            failures.incrementAndGet();
            LOG.error("Persistence write failed: {}", description, e);
        }
    }
}
