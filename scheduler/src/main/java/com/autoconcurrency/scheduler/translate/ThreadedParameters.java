package com.autoconcurrency.scheduler.translate;

import java.util.List;

/**
 * Configuration of the in-process {@code ThreadedExecutor}.
 *
 * @param workerCount     size of the worker pool, at least 1
 * @param groupingEnabled dispatch same-group items as one unit
 */
public record ThreadedParameters(int workerCount, boolean groupingEnabled) {

    public ThreadedParameters {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, was " + workerCount);
        }
    }

    /** Command-line form understood by the threaded runner: {@code --workers N}. */
    public List<String> toArguments() {
        return List.of("--workers", String.valueOf(workerCount));
    }
}
