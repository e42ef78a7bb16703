package com.autoconcurrency.scheduler.cli;

import com.autoconcurrency.scheduler.decision.InvalidConfigurationException;
import com.autoconcurrency.scheduler.decision.StrategyOverride;
import com.autoconcurrency.scheduler.decision.WorkerRequest;
import com.autoconcurrency.scheduler.model.GroupingScope;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Extracts the concurrency options from a runner's argument list.
 *
 * Recognised:
 * <pre>
 *   --concurrency N | auto     (also --concurrency=N)
 *   --task-grouping [file|package]   (also --task-grouping=...; bare flag means file)
 *   --multithreading           force the threaded strategy
 *   --multiprocessing          force the isolated-process strategy
 *   --concurrency-debug        log the decision inputs at INFO
 * </pre>
 * These options are always removed from the returned argument list; every
 * other argument keeps its position.
 */
public final class ConcurrencyOptions {

    static final String CONCURRENCY     = "--concurrency";
    static final String TASK_GROUPING   = "--task-grouping";
    static final String MULTITHREADING  = "--multithreading";
    static final String MULTIPROCESSING = "--multiprocessing";
    static final String DEBUG           = "--concurrency-debug";

    private ConcurrencyOptions() {}

    /**
     * @throws InvalidConfigurationException on a missing or malformed value,
     *                                       or when both force flags are set
     */
    public static ParsedOptions parse(List<String> args) {
        String  concurrency     = null;
        String  grouping        = null;
        boolean forceThreads    = false;
        boolean forceProcesses  = false;
        boolean debug           = false;
        List<String> remaining  = new ArrayList<>(args.size());

        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg.equals(CONCURRENCY)) {
                if (i + 1 >= args.size()) {
                    throw new InvalidConfigurationException(CONCURRENCY + " requires a value");
                }
                concurrency = args.get(++i);
            } else if (arg.startsWith(CONCURRENCY + "=")) {
                concurrency = arg.substring(CONCURRENCY.length() + 1);
            } else if (arg.equals(TASK_GROUPING)) {
                if (i + 1 < args.size() && !args.get(i + 1).startsWith("-")) {
                    grouping = args.get(++i);
                } else {
                    grouping = GroupingScope.FILE.optionValue();
                }
            } else if (arg.startsWith(TASK_GROUPING + "=")) {
                grouping = arg.substring(TASK_GROUPING.length() + 1);
            } else if (arg.equals(MULTITHREADING)) {
                forceThreads = true;
            } else if (arg.equals(MULTIPROCESSING)) {
                forceProcesses = true;
            } else if (arg.equals(DEBUG)) {
                debug = true;
            } else {
                remaining.add(arg);
            }
        }

        if (concurrency == null) {
            return new ParsedOptions(Optional.empty(), remaining, debug);
        }

        GroupingScope scope = grouping == null ? null : parseScope(grouping);
        StrategyOverride override = StrategyOverride.fromFlags(
                forceThreads, forceProcesses, WorkerRequest.parse(concurrency), scope);
        return new ParsedOptions(Optional.of(override), remaining, debug);
    }

    private static GroupingScope parseScope(String value) {
        return GroupingScope.fromOptionValue(value).orElseThrow(() ->
                new InvalidConfigurationException(
                        "Invalid " + TASK_GROUPING + " value: " + value + " (expected file or package)"));
    }
}
