package com.codenames.backend.agent;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Runs collaborator calls with a deadline. Timeouts, errors and interruption all yield the fallback,
 * so a hung model call can never hold up a turn.
 */
@Slf4j
public class AgentCallGuard {

    private final ExecutorService executor;
    private final Duration timeout;

    public AgentCallGuard(ExecutorService executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    public <T> T call(String description, Callable<T> call, Supplier<T> fallback) {
        Future<T> future;
        try {
            future = executor.submit(call);
        } catch (RejectedExecutionException e) {
            log.warn("{} rejected by agent pool, using fallback", description);
            return fallback.get();
        }

        try {
            T result = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (result == null) {
                log.warn("{} returned nothing, using fallback", description);
                return fallback.get();
            }
            return result;
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} timed out after {} ms, using fallback", description, timeout.toMillis());
            return fallback.get();
        } catch (ExecutionException e) {
            log.warn("{} failed, using fallback: {}", description, String.valueOf(e.getCause()));
            return fallback.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("{} interrupted, using fallback", description);
            return fallback.get();
        }
    }
}
