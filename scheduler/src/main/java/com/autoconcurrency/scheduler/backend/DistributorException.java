package com.autoconcurrency.scheduler.backend;

/**
 * Thrown when the isolated-process distributor returns an error or a report
 * that does not account for every submitted item.
 */
public class DistributorException extends RuntimeException {

    public DistributorException(String message) {
        super(message);
    }

    public DistributorException(String message, Throwable cause) {
        super(message, cause);
    }
}
