package com.autoconcurrency.scheduler.executor;

/**
 * Thrown when a threaded run cannot produce a report, e.g. the calling
 * thread was interrupted while waiting for its workers.
 */
public class SchedulerException extends RuntimeException {

    public SchedulerException(String message, Throwable cause) {
        super(message, cause);
    }
}
