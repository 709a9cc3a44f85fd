package io.campus.core.pipeline;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs external calls on an I/O pool with a per-call deadline. A call that misses its deadline is
 * interrupted and reported as a timed-out {@link StageException}.
 */
public final class StageExecutor implements AutoCloseable {
    private final ExecutorService executor;

    public StageExecutor() {
        this(Executors.newCachedThreadPool(daemonThreads("campus-io-")));
    }

    public StageExecutor(ExecutorService executor) {
        this.executor = executor;
    }

    public <T> T call(String stage, Duration timeout, StageCall<T> call) throws StageException {
        Callable<T> task = call::call;
        Future<T> future = executor.submit(task);
        long timeoutMs = Math.max(1, timeout.toMillis());
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw StageException.timeout(stage, timeoutMs);
        } catch (ExecutionException e) {
            throw StageException.failed(stage, e.getCause());
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw StageException.failed(stage, e);
        }
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    static ThreadFactory daemonThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @FunctionalInterface
    public interface StageCall<T> {
        T call() throws Exception;
    }
}
