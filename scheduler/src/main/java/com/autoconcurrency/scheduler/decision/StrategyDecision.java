package com.autoconcurrency.scheduler.decision;

import com.autoconcurrency.scheduler.model.GroupingScope;
import com.autoconcurrency.scheduler.model.Strategy;

/**
 * Outcome of the strategy decision. Computed once per run.
 *
 * @param strategy        threaded or isolated-process
 * @param workerCount     number of workers, at least 1
 * @param groupingEnabled keep same-group items on one worker
 * @param groupingScope   FILE or PACKAGE; only meaningful when grouping is enabled
 */
public record StrategyDecision(
        Strategy      strategy,
        int           workerCount,
        boolean       groupingEnabled,
        GroupingScope groupingScope) {

    public StrategyDecision {
        if (workerCount < 1) {
            throw new IllegalArgumentException("workerCount must be >= 1, was " + workerCount);
        }
        if (groupingScope == null) {
            groupingScope = GroupingScope.FILE;
        }
    }
}
