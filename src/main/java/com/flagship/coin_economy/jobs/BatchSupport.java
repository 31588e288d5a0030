package com.flagship.coin_economy.jobs;

import com.flagship.coin_economy.exception.StoreUnavailableException;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionTimedOutException;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared plumbing for the batch jobs: bounded calls to slow collaborators,
 * pacing between items and classification of failures.
 */
@Component
@Slf4j
public class BatchSupport {

    private final ExecutorService executor;

    public BatchSupport() {
        AtomicInteger counter = new AtomicInteger();
        this.executor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "batch-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs a task on a worker thread and waits at most {@code timeout} for it.
     * The caller's MDC is carried over to the worker.
     *
     * @throws TimeoutException if the task did not finish in time; the task is interrupted
     * @throws RuntimeException the task's own failure, unwrapped
     */
    public void runWithTimeout(Runnable task, Duration timeout) throws TimeoutException {
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<?> future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                task.run();
            } finally {
                MDC.clear();
            }
        });
        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for batch call", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Batch call failed", cause);
        }
    }

    /**
     * Sleeps between items.
     *
     * @return false if the thread was interrupted and the run should stop
     */
    public boolean pause(long millis) {
        if (millis <= 0) {
            return true;
        }
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Batch run interrupted during pause");
            return false;
        }
    }

    /**
     * True if the failure is worth retrying on a later run: lock timeouts,
     * lost connections, transaction timeouts.
     */
    public static boolean isTransient(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof TransientDataAccessException
                    || current instanceof DataAccessResourceFailureException
                    || current instanceof CannotCreateTransactionException
                    || current instanceof TransactionTimedOutException
                    || current instanceof StoreUnavailableException) {
                return true;
            }
            current = current.getCause() == current ? null : current.getCause();
        }
        return false;
    }

    @PreDestroy
    public void shutdown() {
        executor.shutdownNow();
    }
}
