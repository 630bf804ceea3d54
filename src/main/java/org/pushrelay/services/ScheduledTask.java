package org.pushrelay.services;

/**
 * Work run by {@link TaskScheduler} at a fixed rate.
 */
public interface ScheduledTask {

    /** Used in log lines and as the MDC component. */
    String name();

    long intervalSeconds();

    /** Delay before the first run. */
    default long initialDelaySeconds() {
        return 0;
    }

    /**
     * Exceptions escaping here are logged by the scheduler; the next run still happens.
     */
    void execute();
}
