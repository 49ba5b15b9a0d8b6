package tech.manajer.messaging.repository;

import jakarta.annotation.PreDestroy;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.jboss.logging.Logger;
import tech.manajer.messaging.config.MessagingConfig;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs persistence calls with an upper bound on how long the caller waits.
 *
 * A call that overruns is not cancelled: it finishes on its own thread and
 * its result is dropped. Threads and queued calls are both bounded, so a hung
 * store exhausts the pool instead of growing it; calls refused by a full pool
 * fail like a timeout.
 */
@Singleton
public class PersistenceExecutor {

    private static final Logger LOG = Logger.getLogger(PersistenceExecutor.class);

    private final ExecutorService executor;
    private final Duration timeout;

    @Inject
    public PersistenceExecutor(MessagingConfig config) {
        this(boundedPool(config.persistenceThreads(), config.persistenceQueueCapacity()), config.operationTimeout());
    }

    PersistenceExecutor(ExecutorService executor, Duration timeout) {
        this.executor = executor;
        this.timeout = timeout;
    }

    /**
     * Fixed-size pool with a bounded queue that rejects when full.
     */
    static ThreadPoolExecutor boundedPool(int threads, int queueCapacity) {
        ThreadPoolExecutor pool = new ThreadPoolExecutor(
            threads, threads,
            60, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(queueCapacity),
            new PersistenceThreadFactory(),
            new ThreadPoolExecutor.AbortPolicy());
        pool.allowCoreThreadTimeOut(true);
        return pool;
    }

    /**
     * Run {@code work} and wait for it up to the configured timeout.
     *
     * @param operation name used in logs and in the timeout exception
     * @throws OperationTimeoutException if the bound is exceeded or the pool is saturated
     */
    public <T> T call(String operation, Supplier<T> work) {
        Future<T> future;
        try {
            future = executor.submit(work::get);
        } catch (RejectedExecutionException e) {
            LOG.warnf("Persistence pool saturated, refusing %s", operation);
            throw new OperationTimeoutException(operation, timeout);
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            throw new OperationTimeoutException(operation, timeout);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(operation + " failed", cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for " + operation, e);
        }
    }

    @PreDestroy
    void shutdown() {
        LOG.debug("Shutting down persistence executor");
        executor.shutdown();
    }

    private static final class PersistenceThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread thread = new Thread(r, "messaging-persistence-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
