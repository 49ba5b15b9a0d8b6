package tech.manajer.messaging.repository;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;
import static org.awaitility.Awaitility.await;

class PersistenceExecutorTest {

    private final ExecutorService pool = Executors.newCachedThreadPool();

    @AfterEach
    void tearDown() {
        pool.shutdownNow();
    }

    @Test
    @DisplayName("call should return the result of work that finishes in time")
    void call_shouldReturnResult() {
        PersistenceExecutor executor = new PersistenceExecutor(pool, Duration.ofSeconds(5));

        assertThat(executor.call("create message", () -> "saved")).isEqualTo("saved");
    }

    @Test
    @DisplayName("call should rethrow runtime exceptions from the work unchanged")
    void call_shouldPropagateRuntimeException() {
        PersistenceExecutor executor = new PersistenceExecutor(pool, Duration.ofSeconds(5));
        IllegalStateException failure = new IllegalStateException("connection refused");

        assertThatThrownBy(() -> executor.call("delete message", () -> {
            throw failure;
        })).isSameAs(failure);
    }

    @Test
    @DisplayName("call should time out without cancelling the work")
    void call_shouldTimeOutWithoutCancelling() {
        // Arrange
        PersistenceExecutor executor = new PersistenceExecutor(pool, Duration.ofMillis(50));
        CountDownLatch release = new CountDownLatch(1);
        AtomicBoolean completed = new AtomicBoolean();

        // Act & Assert
        assertThatThrownBy(() -> executor.call("update message", () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return null;
            }
            completed.set(true);
            return null;
        }))
            .isInstanceOf(OperationTimeoutException.class)
            .hasMessage("update message did not complete within 50ms");

        release.countDown();
        await().atMost(Duration.ofSeconds(5)).untilTrue(completed);
    }

    @Test
    @DisplayName("call should fail fast as a timeout when every thread and queue slot is taken")
    void call_shouldRejectAsTimeout_whenPoolIsSaturated() {
        // Arrange: one thread and one queue slot, both held by a hung store
        ThreadPoolExecutor bounded = PersistenceExecutor.boundedPool(1, 1);
        PersistenceExecutor executor = new PersistenceExecutor(bounded, Duration.ofMillis(50));
        CountDownLatch release = new CountDownLatch(1);
        Supplier<String> hung = () -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return "late";
        };

        try {
            assertThatThrownBy(() -> executor.call("create message", hung))
                .isInstanceOf(OperationTimeoutException.class);
            assertThatThrownBy(() -> executor.call("create message", hung))
                .isInstanceOf(OperationTimeoutException.class);
            assertThat(bounded.getPoolSize()).isEqualTo(1);
            assertThat(bounded.getQueue()).hasSize(1);

            // Act & Assert
            long started = System.nanoTime();
            assertThatThrownBy(() -> executor.call("delete message", () -> "never runs"))
                .isInstanceOf(OperationTimeoutException.class)
                .hasMessage("delete message did not complete within 50ms");
            assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(1));
            assertThat(bounded.getPoolSize()).isEqualTo(1);
        } finally {
            release.countDown();
            bounded.shutdownNow();
        }
    }
}
