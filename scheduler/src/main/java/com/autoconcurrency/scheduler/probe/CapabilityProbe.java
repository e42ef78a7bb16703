package com.autoconcurrency.scheduler.probe;

/**
 * Reports how many units of parallel execution the host offers.
 */
public interface CapabilityProbe {

    /** Always at least 1; implementations fall back to 1 when the host cannot be read. */
    int availableParallelism();
}
