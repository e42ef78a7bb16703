package com.autoconcurrency.scheduler.model;

/**
 * How a run is executed.
 *
 * THREADED          : in-process worker threads sharing the JVM's memory;
 *                     failures are contained per item by the executor.
 * ISOLATED_PROCESS  : delegated to the external distributor, which runs
 *                     items in separate processes.
 */
public enum Strategy {
    THREADED,
    ISOLATED_PROCESS
}
