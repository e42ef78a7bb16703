package com.autoconcurrency.scheduler.model;

/**
 * Final status of a single WorkItem in a RunReport.
 *
 *   PASSED    : body completed normally
 *   FAILED    : body raised an AssertionError
 *   ERRORED   : body raised anything else
 *   CANCELLED : the run was cancelled before the item was dispatched
 */
public enum ItemStatus {
    PASSED,
    FAILED,
    ERRORED,
    CANCELLED
}
