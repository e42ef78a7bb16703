package com.autoconcurrency.scheduler.decision;

import com.autoconcurrency.scheduler.model.GroupingScope;

import java.util.Objects;

/**
 * Already-parsed user intent handed to {@link StrategySelector}.
 *
 * @param mode              explicit strategy choice, or AUTO
 * @param workers           requested worker count, or auto
 * @param groupingRequested keep same-group items on one worker
 * @param groupingScope     how group keys were derived; FILE unless stated
 */
public record StrategyOverride(
        StrategyMode  mode,
        WorkerRequest workers,
        boolean       groupingRequested,
        GroupingScope groupingScope) {

    public StrategyOverride {
        Objects.requireNonNull(mode, "mode");
        if (workers == null) {
            workers = WorkerRequest.auto();
        }
        if (groupingScope == null) {
            groupingScope = GroupingScope.FILE;
        }
    }

    /** Auto strategy, one worker per core, no grouping. */
    public static StrategyOverride auto() {
        return new StrategyOverride(StrategyMode.AUTO, WorkerRequest.auto(), false, GroupingScope.FILE);
    }

    /**
     * Build an override from the two force flags of the command line.
     *
     * @param groupingScope null when grouping was not requested
     * @throws InvalidConfigurationException if both flags are set
     */
    public static StrategyOverride fromFlags(boolean forceThreaded,
                                             boolean forceIsolatedProcess,
                                             WorkerRequest workers,
                                             GroupingScope groupingScope) {
        if (forceThreaded && forceIsolatedProcess) {
            throw new InvalidConfigurationException(
                    "--multithreading and --multiprocessing are mutually exclusive");
        }
        StrategyMode mode = forceThreaded ? StrategyMode.FORCE_THREADED
                : forceIsolatedProcess ? StrategyMode.FORCE_ISOLATED_PROCESS
                : StrategyMode.AUTO;
        return new StrategyOverride(mode, workers, groupingScope != null, groupingScope);
    }

    public StrategyOverride withWorkers(WorkerRequest requested) {
        return new StrategyOverride(mode, requested, groupingRequested, groupingScope);
    }

    public StrategyOverride withGrouping(GroupingScope scope) {
        return new StrategyOverride(mode, workers, true, scope);
    }
}
