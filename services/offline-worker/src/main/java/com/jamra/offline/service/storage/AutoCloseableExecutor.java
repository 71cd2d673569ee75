package com.jamra.offline.service.storage;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * ExecutorService wrapper usable in try-with-resources. Closing waits for submitted work up to
 * {@code awaitTimeout}, then forces shutdown.
 *
 * <pre>
 * try (AutoCloseableExecutor batch = new AutoCloseableExecutor(Executors.newFixedThreadPool(2), Duration.ofMinutes(5))) {
 *     batch.executor().submit(() -> { ... });
 * }
 * </pre>
 */
record AutoCloseableExecutor(ExecutorService executor, Duration awaitTimeout) implements AutoCloseable {

    /**
     * @return {@code true} when every task finished before the timeout
     */
    boolean shutdownAndAwait() {
        executor.shutdown();
        try {
            if (executor.awaitTermination(awaitTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                return true;
            }
            executor.shutdownNow();
            return false;
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            return false;
        }
    }

    @Override
    public void close() {
        shutdownAndAwait();
    }
}
