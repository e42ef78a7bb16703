package com.autoconcurrency.scheduler.decision;

/**
 * Contradictory or malformed concurrency options (both force flags set,
 * non-positive or non-numeric worker count, unknown grouping scope).
 *
 * Always raised before any WorkItem is executed.
 */
public class InvalidConfigurationException extends RuntimeException {

    public InvalidConfigurationException(String message) {
        super(message);
    }

    public InvalidConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
