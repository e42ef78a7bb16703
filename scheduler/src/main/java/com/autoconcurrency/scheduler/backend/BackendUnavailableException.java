package com.autoconcurrency.scheduler.backend;

/**
 * The isolated-process backend is not configured or cannot be reached.
 *
 * Fatal to the run. Callers must not fall back to the threaded strategy.
 */
public class BackendUnavailableException extends DistributorException {

    private final String backend;

    public BackendUnavailableException(String backend, String reason) {
        super("Isolated-process backend '" + backend + "' is unavailable: " + reason);
        this.backend = backend;
    }

    public BackendUnavailableException(String backend, String reason, Throwable cause) {
        super("Isolated-process backend '" + backend + "' is unavailable: " + reason, cause);
        this.backend = backend;
    }

    public String getBackend() { return backend; }
}
