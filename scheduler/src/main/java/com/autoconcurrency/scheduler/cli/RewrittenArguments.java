package com.autoconcurrency.scheduler.cli;

import com.autoconcurrency.scheduler.decision.StrategyDecision;
import com.autoconcurrency.scheduler.translate.DistributionMode;

import java.util.List;
import java.util.Optional;

/**
 * Output of {@link ArgumentRewriter}.
 *
 * @param decision         empty when no {@code --concurrency} was given
 * @param distributionMode set only for an isolated-process decision
 * @param args             arguments to hand to the selected runner
 */
public record RewrittenArguments(
        Optional<StrategyDecision> decision,
        Optional<DistributionMode> distributionMode,
        List<String>               args) {

    public RewrittenArguments {
        args = List.copyOf(args);
    }
}
