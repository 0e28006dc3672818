package com.example.modelbridge.http;

import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * The single thread every document access of one host runs on. Request threads of both channels
 * hand their work over and wait for the result, so handlers never overlap.
 */
@Slf4j
public class BridgeEventLoop {

    private static final AtomicInteger INSTANCES = new AtomicInteger();

    private final ExecutorService executor;

    public BridgeEventLoop() {
        String threadName = "model-bridge-event-" + INSTANCES.incrementAndGet();
        this.executor = Executors.newSingleThreadExecutor(runnable -> new Thread(runnable, threadName));
    }

    /**
     * Runs {@code task} on the event thread and waits for it. Runtime exceptions thrown by the task
     * reach the caller unchanged.
     */
    public <T> T call(Supplier<T> task) {
        Callable<T> callable = task::get;
        Future<T> future;
        try {
            future = executor.submit(callable);
        } catch (RejectedExecutionException e) {
            throw new IllegalStateException("Model bridge is stopped", e);
        }
        try {
            return future.get();
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for the event thread", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }

    public void shutdown() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Event thread did not finish within 5s; interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
