package com.agentrelay.core.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Supplier;

/**
 * Strict FIFO admission queue with a fixed concurrency limit.
 * <p>
 * A job is a supplier that starts some asynchronous work and returns its stage. At most
 * {@code maxConcurrency} stages are outstanding at once; a slot freed by a completing job
 * immediately admits the oldest waiting job.
 */
public class ProcessQueue {

    private static final Logger log = LoggerFactory.getLogger(ProcessQueue.class);

    public static final int DEFAULT_MAX_CONCURRENCY = 2;

    private final int maxConcurrency;
    private final Deque<QueuedJob<?>> waiting = new ArrayDeque<>();
    private int running;
    private final ThreadLocal<Deque<QueuedJob<?>>> draining = new ThreadLocal<>();

    public ProcessQueue() {
        this(DEFAULT_MAX_CONCURRENCY);
    }

    public ProcessQueue(int maxConcurrency) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be at least 1, got " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
    }

    /**
     * Runs the job now if a slot is free, otherwise queues it behind earlier jobs.
     *
     * @return completes with the job's own outcome
     */
    public <T> CompletableFuture<T> add(Supplier<? extends CompletionStage<T>> job) {
        QueuedJob<T> queued = new QueuedJob<>(job, new CompletableFuture<>());
        boolean runNow;
        synchronized (this) {
            runNow = running < maxConcurrency;
            if (runNow) {
                running++;
            } else {
                waiting.addLast(queued);
                log.debug("Queued job ({} running, {} waiting)", running, waiting.size());
            }
        }
        if (runNow) {
            launch(queued);
        }
        return queued.result();
    }

    public synchronized QueueStats stats() {
        return new QueueStats(running, waiting.size(), maxConcurrency);
    }

    public int maxConcurrency() {
        return maxConcurrency;
    }

    /**
     * Starts {@code first} and any jobs admitted while it starts. A job whose stage is already
     * complete releases its slot on this thread; the successor is then taken from the drain loop
     * instead of a nested call, so a long run of such jobs keeps the stack flat.
     */
    private void launch(QueuedJob<?> first) {
        Deque<QueuedJob<?>> pending = draining.get();
        if (pending != null) {
            pending.addLast(first);
            return;
        }
        pending = new ArrayDeque<>();
        pending.addLast(first);
        draining.set(pending);
        try {
            QueuedJob<?> next;
            while ((next = pending.pollFirst()) != null) {
                start(next);
            }
        } finally {
            draining.remove();
        }
    }

    private <T> void start(QueuedJob<T> queued) {
        CompletionStage<T> stage;
        try {
            stage = queued.job().get();
        } catch (RuntimeException e) {
            stage = CompletableFuture.failedFuture(e);
        }
        stage.whenComplete((value, error) -> {
            release();
            if (error != null) {
                queued.result().completeExceptionally(error);
            } else {
                queued.result().complete(value);
            }
        });
    }

    private void release() {
        QueuedJob<?> next;
        synchronized (this) {
            next = waiting.pollFirst();
            if (next == null) {
                running--;
            }
        }
        if (next != null) {
            launch(next);
        }
    }

    private record QueuedJob<T>(Supplier<? extends CompletionStage<T>> job, CompletableFuture<T> result) {}

    /**
     * @param running        jobs currently holding a slot
     * @param queued         jobs waiting for a slot
     * @param maxConcurrency configured limit
     */
    public record QueueStats(int running, int queued, int maxConcurrency) {}
}
