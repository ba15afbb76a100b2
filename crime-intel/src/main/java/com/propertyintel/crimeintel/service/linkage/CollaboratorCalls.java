package com.propertyintel.crimeintel.service.linkage;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs a graph or search call as its own task. A call that fails or runs out
 * of time yields the fallback value.
 *
 * The per-call timeout starts when the task starts running, so time spent
 * queued behind other tasks is not charged to the call. Queued tasks are
 * still bounded by the deadline, and a task that starts after the deadline
 * returns the fallback without calling the backend.
 */
@Slf4j
final class CollaboratorCalls {

    private CollaboratorCalls() {}

    static <T> CompletableFuture<T> submit(String label, Supplier<T> call, Executor executor,
                                           Duration perCall, Instant deadline, T fallback) {
        if (expired(deadline)) {
            return CompletableFuture.completedFuture(fallback);
        }

        CompletableFuture<T> result = new CompletableFuture<>();
        result.completeOnTimeout(fallback, millis(Duration.between(Instant.now(), deadline)), TimeUnit.MILLISECONDS);

        try {
            executor.execute(() -> run(label, call, perCall, deadline, fallback, result));
        } catch (RejectedExecutionException e) {
            log.warn("{}: executor saturated, skipping call", label);
            result.complete(fallback);
        }
        return result;
    }

    static <T> T await(String label, Supplier<T> call, Executor executor,
                       Duration perCall, Instant deadline, T fallback) {
        return submit(label, call, executor, perCall, deadline, fallback).join();
    }

    private static <T> void run(String label, Supplier<T> call, Duration perCall, Instant deadline,
                                T fallback, CompletableFuture<T> result) {
        if (result.isDone()) return;
        if (expired(deadline)) {
            log.debug("{}: deadline passed before the call started", label);
            result.complete(fallback);
            return;
        }

        result.completeOnTimeout(fallback, millis(callTimeout(perCall, deadline)), TimeUnit.MILLISECONDS);
        try {
            result.complete(call.get());
        } catch (RuntimeException e) {
            log.warn("{} failed: {}", label, e.getMessage());
            result.complete(fallback);
        }
    }

    /** The per-call timeout, shortened so the call cannot outlive the deadline. */
    static Duration callTimeout(Duration perCall, Instant deadline) {
        Duration remaining = Duration.between(Instant.now(), deadline);
        return remaining.compareTo(perCall) < 0 ? remaining : perCall;
    }

    static boolean expired(Instant deadline) {
        return !Instant.now().isBefore(deadline);
    }

    private static long millis(Duration duration) {
        return Math.max(1, duration.toMillis());
    }
}
