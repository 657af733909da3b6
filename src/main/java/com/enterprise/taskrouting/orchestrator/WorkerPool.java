package com.enterprise.taskrouting.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.RejectedExecutionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Bounded pool of task workers. Each in-flight task runs on its own worker,
 * so a backoff sleep only delays the task that is retrying.
 */
public class WorkerPool {

    private static final Logger logger = LoggerFactory.getLogger(WorkerPool.class);

    private final ThreadPoolExecutor executor;
    private final AtomicLong totalSubmitted = new AtomicLong(0);

    public WorkerPool(int workerThreads) {
        this.executor = new ThreadPoolExecutor(
            workerThreads,
            workerThreads,
            60L,
            TimeUnit.SECONDS,
            new LinkedBlockingQueue<>(),
            new WorkerThreadFactory(),
            new WorkerRejectedExecutionHandler()
        );

        logger.info("WorkerPool initialized with {} workers", workerThreads);
    }

    /**
     * Runs a unit of work on a worker
     *
     * @throws RejectedExecutionException if the pool is shut down
     */
    public Future<?> submit(Runnable work) {
        Future<?> future = executor.submit(work);
        totalSubmitted.incrementAndGet();
        return future;
    }

    /**
     * Stops accepting work and interrupts running workers, waiting up to {@code timeout}
     * for them to finish their cleanup
     *
     * @return true if every worker finished within the timeout
     */
    public boolean shutdownNow(Duration timeout) {
        logger.info("Shutting down WorkerPool...");
        executor.shutdownNow();
        try {
            boolean terminated = executor.awaitTermination(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!terminated) {
                logger.warn("Workers did not terminate within {}", timeout);
            }
            return terminated;
        } catch (InterruptedException e) {
            logger.error("Interrupted during shutdown", e);
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isRunning() {
        return !executor.isShutdown() && !executor.isTerminated();
    }

    public int getActiveCount() {
        return executor.getActiveCount();
    }

    public int getQueueSize() {
        return executor.getQueue().size();
    }

    public long getTotalSubmitted() {
        return totalSubmitted.get();
    }

    /**
     * Names worker threads so per-task log lines are attributable
     */
    private static class WorkerThreadFactory implements ThreadFactory {
        private final AtomicLong threadNumber = new AtomicLong(1);
        private final String namePrefix = "task-worker-";

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + threadNumber.getAndIncrement());
            t.setDaemon(false);
            t.setPriority(Thread.NORM_PRIORITY);
            return t;
        }
    }

    private static class WorkerRejectedExecutionHandler implements RejectedExecutionHandler {
        @Override
        public void rejectedExecution(Runnable r, ThreadPoolExecutor executor) {
            logger.error("Task work rejected - worker pool is shut down");
            throw new RejectedExecutionException("Task work rejected - worker pool is shut down");
        }
    }
}
