package com.querypilot.util;

import com.querypilot.error.ErrorKind;
import com.querypilot.error.QueryPilotException;
import org.springframework.core.task.AsyncTaskExecutor;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Absolute point in time by which a request must finish. Passed through every external call.
 */
public final class Deadline {

    private final long expiresAtNanos;

    private Deadline(long expiresAtNanos) {
        this.expiresAtNanos = expiresAtNanos;
    }

    public static Deadline after(Duration budget) {
        return new Deadline(System.nanoTime() + budget.toNanos());
    }

    public Duration remaining() {
        long left = expiresAtNanos - System.nanoTime();
        return left > 0 ? Duration.ofNanos(left) : Duration.ZERO;
    }

    public boolean isExpired() {
        return expiresAtNanos - System.nanoTime() <= 0;
    }

    /**
     * Remaining time, but no more than {@code max}.
     */
    public Duration capped(Duration max) {
        Duration remaining = remaining();
        return remaining.compareTo(max) < 0 ? remaining : max;
    }

    /**
     * Run an external call on {@code executor} and wait for it no longer than {@code limit} or the remaining budget.
     * On expiry the in-flight call is cancelled (interrupted) and a {@link ErrorKind#TIMEOUT} failure is raised.
     *
     * @param operation short name of the call for error messages
     * @param executor executor running the call
     * @param limit per-call ceiling
     * @param call the call
     * @return call result
     */
    public <T> T call(String operation, AsyncTaskExecutor executor, Duration limit, Supplier<T> call) {
        Duration wait = capped(limit);
        if (wait.isZero()) {
            throw timeout(operation);
        }
        Callable<T> task = call::get;
        Future<T> future = executor.submit(task);
        try {
            return future.get(wait.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw timeout(operation);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new QueryPilotException(ErrorKind.TIMEOUT, operation + " was interrupted", List.of(), e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new QueryPilotException(ErrorKind.INTERNAL_ERROR, operation + " failed", List.of(), cause);
        }
    }

    public <T> T call(String operation, AsyncTaskExecutor executor, Supplier<T> call) {
        return call(operation, executor, remaining(), call);
    }

    private static QueryPilotException timeout(String operation) {
        return new QueryPilotException(ErrorKind.TIMEOUT, operation + " did not finish in time",
                List.of("Try a narrower question", "Retry in a moment"));
    }
}
