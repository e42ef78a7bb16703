package com.autoconcurrency.scheduler.executor;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Run-level cancellation flag.
 *
 * Once set, workers take no further DispatchUnits from the queue. A unit that
 * is already running is finished; threads are never interrupted mid-unit.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
