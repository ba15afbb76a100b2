package com.propertyintel.crimeintel.service.linkage;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;

class CollaboratorCallsTest {

    private ExecutorService executor;

    @BeforeEach
    void setUp() {
        executor = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private static Supplier<String> slow(String value, long millis, AtomicInteger calls) {
        return () -> {
            calls.incrementAndGet();
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return value;
        };
    }

    @Test
    void timeSpentQueuedIsNotChargedToTheCall() {
        AtomicInteger calls = new AtomicInteger();
        Instant deadline = Instant.now().plusSeconds(10);
        List<CompletableFuture<String>> futures = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            futures.add(CollaboratorCalls.submit("call " + i, slow("ok-" + i, 150, calls), executor,
                    Duration.ofMillis(400), deadline, "fallback"));
        }

        assertThat(futures).extracting(CompletableFuture::join)
                .containsExactly("ok-0", "ok-1", "ok-2", "ok-3");
    }

    @Test
    void slowCallIsCutOffAfterItsOwnTimeout() {
        AtomicInteger calls = new AtomicInteger();

        String result = CollaboratorCalls.await("slow call", slow("late", 2_000, calls), executor,
                Duration.ofMillis(100), Instant.now().plusSeconds(10), "fallback");

        assertThat(result).isEqualTo("fallback");
    }

    @Test
    void taskStartingAfterTheDeadlineDoesNotCallTheBackend() throws Exception {
        AtomicInteger blockerCalls = new AtomicInteger();
        AtomicInteger lateCalls = new AtomicInteger();
        Instant deadline = Instant.now().plusMillis(150);

        CollaboratorCalls.submit("blocker", slow("done", 400, blockerCalls), executor,
                Duration.ofSeconds(5), Instant.now().plusSeconds(10), "fallback");
        CompletableFuture<String> queued = CollaboratorCalls.submit("queued", slow("late", 10, lateCalls), executor,
                Duration.ofSeconds(5), deadline, "fallback");

        assertThat(queued.join()).isEqualTo("fallback");
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();
        assertThat(blockerCalls).hasValue(1);
        assertThat(lateCalls).hasValue(0);
    }

    @Test
    void failingCallYieldsFallback() {
        String result = CollaboratorCalls.await("failing call", () -> {
            throw new IllegalStateException("connection refused");
        }, executor, Duration.ofSeconds(1), Instant.now().plusSeconds(10), "fallback");

        assertThat(result).isEqualTo("fallback");
    }

    @Test
    void expiredDeadlineSubmitsNothing() {
        AtomicInteger calls = new AtomicInteger();

        String result = CollaboratorCalls.await("expired", slow("x", 1, calls), executor,
                Duration.ofSeconds(1), Instant.now().minusSeconds(1), "fallback");

        assertThat(result).isEqualTo("fallback");
        assertThat(calls).hasValue(0);
    }
}
