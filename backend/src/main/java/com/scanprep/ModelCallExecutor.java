package com.scanprep;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Runs external model calls one at a time on a dedicated thread, each bounded by a timeout.
 * <p>
 * Both models may hold an exclusive device, so calls from the worker pool are serialized.
 * The timeout starts when a call actually begins, not while it waits for its turn.
 * A call that times out is cancelled with an interrupt.
 */
public class ModelCallExecutor implements AutoCloseable {

    private final ExecutorService executor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "model-call");
        t.setDaemon(true);
        return t;
    });
    private final ReentrantLock turn = new ReentrantLock(true);
    private final Duration timeout;

    public ModelCallExecutor(Duration timeout) {
        if (timeout == null || timeout.isNegative() || timeout.isZero()) {
            throw new ConfigException("Model timeout must be positive, got " + timeout);
        }
        this.timeout = timeout;
    }

    public <T> T call(Callable<T> task) throws ExecutionException, TimeoutException, InterruptedException {
        turn.lockInterruptibly();
        try {
            Future<T> future = executor.submit(task);
            try {
                return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException | InterruptedException e) {
                future.cancel(true);
                throw e;
            }
        } finally {
            turn.unlock();
        }
    }

    public Duration getTimeout() {
        return timeout;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }
}
