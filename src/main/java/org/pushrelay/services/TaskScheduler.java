package org.pushrelay.services;

import org.pushrelay.config.utils.LogContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs registered tasks at a fixed rate. A task never overlaps with itself:
 * a run that takes longer than its interval delays the next one.
 */
public class TaskScheduler {
    private static final Logger logger = LoggerFactory.getLogger(TaskScheduler.class);

    private final ScheduledThreadPoolExecutor executor;
    private final List<ScheduledFuture<?>> futures = new ArrayList<>();
    private final List<ScheduledTask> tasks = new ArrayList<>();

    public TaskScheduler() { this(2); }
    public TaskScheduler(int poolSize) {
        this.executor = new ScheduledThreadPoolExecutor(poolSize);
        this.executor.setRemoveOnCancelPolicy(true);
    }

    /**
     * Register a task for scheduled execution.
     */
    public void register(ScheduledTask task) {
        tasks.add(task);
    }

    /**
     * Start all registered tasks.
     */
    public void start() {
        for (ScheduledTask t : tasks) {
            logger.info("Scheduling task {} every {}s, first run in {}s",
                    t.name(), t.intervalSeconds(), t.initialDelaySeconds());
            ScheduledFuture<?> f = executor.scheduleAtFixedRate(() -> runTaskWithLogging(t),
                    Math.max(t.initialDelaySeconds(), 0), t.intervalSeconds(), TimeUnit.SECONDS);
            futures.add(f);
        }
    }

    void runTaskWithLogging(ScheduledTask task) {
        long start = System.currentTimeMillis();
        LogContext.start(task.name());
        try {
            task.execute();
        } catch (Exception e) {
            logger.error("Error in scheduled task {}: {}", task.name(), e.getMessage(), e);
        } finally {
            logger.debug("Task {} finished in {}ms", task.name(), System.currentTimeMillis() - start);
            LogContext.clear();
        }
    }

    /**
     * Stop all tasks and shutdown executor.
     */
    public void stop() {
        logger.info("Shutting down TaskScheduler...");
        for (ScheduledFuture<?> f : futures) f.cancel(false);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                logger.warn("TaskScheduler did not terminate gracefully");
                executor.shutdownNow();
            } else {
                logger.info("TaskScheduler stopped.");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("TaskScheduler shutdown interrupted.");
        }
    }
}
