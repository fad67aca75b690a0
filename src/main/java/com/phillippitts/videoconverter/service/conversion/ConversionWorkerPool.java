package com.phillippitts.videoconverter.service.conversion;

import com.phillippitts.videoconverter.domain.ConversionJob;
import com.phillippitts.videoconverter.exception.ConversionQueueClosedException;
import com.phillippitts.videoconverter.exception.ConversionQueueFullException;
import com.phillippitts.videoconverter.util.ProcessTimeouts;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Objects;
import java.util.concurrent.ThreadPoolExecutor;

/**
 * Fixed pool of conversion workers on a bounded job queue.
 *
 * <p>Backed by a {@link ThreadPoolTaskExecutor} with {@code workerCount} core and max threads and
 * a queue of twice the worker count. {@link #queueJob(ConversionJob)} never blocks: a saturated
 * queue is rejected ({@link ThreadPoolExecutor.AbortPolicy}) and surfaces as
 * {@link ConversionQueueFullException} so the HTTP tier can answer "busy" immediately.
 *
 * <p><b>Shutdown:</b> {@link #stop()} closes the pool to new jobs, then waits until workers have
 * drained the remaining jobs and finished the ones in flight. Running encoders are not interrupted.
 *
 * <p><b>Thread Safety:</b> all public methods are safe to call concurrently.
 */
public class ConversionWorkerPool {

    private static final Logger LOG = LogManager.getLogger(ConversionWorkerPool.class);

    public static final String DEFAULT_THREAD_NAME_PREFIX = "conversion-worker-";

    private final int workerCount;
    private final ConversionJobRunner runner;
    private final ThreadPoolTaskExecutor executor;

    private volatile boolean started;
    private volatile boolean closed;

    public ConversionWorkerPool(int workerCount, ConversionJobRunner runner) {
        this(workerCount, runner, DEFAULT_THREAD_NAME_PREFIX);
    }

    public ConversionWorkerPool(int workerCount, ConversionJobRunner runner, String threadNamePrefix) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.workerCount = workerCount;
        this.runner = Objects.requireNonNull(runner, "runner");

        executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workerCount);
        executor.setMaxPoolSize(workerCount);
        executor.setQueueCapacity(workerCount * 2);
        executor.setThreadNamePrefix(Objects.requireNonNull(threadNamePrefix, "threadNamePrefix"));
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds((int) ProcessTimeouts.WORKER_SHUTDOWN_TIMEOUT.toSeconds());
    }

    /**
     * Launches exactly {@code workerCount} worker threads.
     *
     * @throws IllegalStateException if already started or stopped
     */
    public synchronized void start() {
        if (started || closed) {
            throw new IllegalStateException("Worker pool already started or stopped");
        }
        executor.initialize();
        executor.getThreadPoolExecutor().prestartAllCoreThreads();
        started = true;
        LOG.info("Started {} conversion workers (queue capacity {})", workerCount, queueCapacity());
    }

    /**
     * Closes the pool and blocks until queued and running jobs are finished. Idempotent.
     */
    public synchronized void stop() {
        if (closed) {
            return;
        }
        closed = true;
        if (!started) {
            return;
        }
        LOG.info("Stopping conversion workers; {} queued job(s) will be drained", queuedJobCount());
        executor.shutdown();
        LOG.info("All conversion workers stopped");
    }

    /**
     * Hands {@code job} to a worker without blocking.
     *
     * @throws ConversionQueueFullException if the queue is at capacity
     * @throws ConversionQueueClosedException if the pool has been stopped
     * @throws IllegalStateException if the pool was never started
     */
    public void queueJob(ConversionJob job) {
        Objects.requireNonNull(job, "job");
        if (closed) {
            throw new ConversionQueueClosedException(job.conversionId());
        }
        if (!started) {
            throw new IllegalStateException("Worker pool not started");
        }
        try {
            executor.execute(() -> runSafely(job));
        } catch (TaskRejectedException e) {
            if (closed || executor.getThreadPoolExecutor().isShutdown()) {
                throw new ConversionQueueClosedException(job.conversionId());
            }
            throw new ConversionQueueFullException(job.conversionId(), queueCapacity());
        }
        LOG.debug("Queued conversion {} (depth {})", job.conversionId(), queuedJobCount());
    }

    public boolean isRunning() {
        return started && !closed;
    }

    public int workerCount() {
        return workerCount;
    }

    /** Jobs waiting for a free worker; excludes the ones being converted. */
    public int queuedJobCount() {
        if (!started) {
            return 0;
        }
        return executor.getThreadPoolExecutor().getQueue().size();
    }

    public int queueCapacity() {
        return workerCount * 2;
    }

    private void runSafely(ConversionJob job) {
        try {
            runner.run(job);
        } catch (RuntimeException e) {
            LOG.error("Worker {} failed on job {}", Thread.currentThread().getName(), job.conversionId(), e);
        }
    }
}
