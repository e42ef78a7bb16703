package com.autoconcurrency.scheduler.cli;

import com.autoconcurrency.scheduler.decision.StrategyOverride;

import java.util.List;
import java.util.Optional;

/**
 * Result of {@link ConcurrencyOptions#parse}.
 *
 * @param override      present only when {@code --concurrency} was given
 * @param remainingArgs the arguments with every concurrency option removed
 * @param debug         {@code --concurrency-debug} was given
 */
public record ParsedOptions(
        Optional<StrategyOverride> override,
        List<String>               remainingArgs,
        boolean                    debug) {

    public ParsedOptions {
        remainingArgs = List.copyOf(remainingArgs);
    }
}
