package com.autoconcurrency.scheduler.api.dto;

import com.autoconcurrency.scheduler.cli.RewrittenArguments;
import com.autoconcurrency.scheduler.decision.StrategyDecision;
import com.autoconcurrency.scheduler.translate.DistributionMode;

import java.util.List;

/**
 * API response for a planned run. Decision fields are null when the
 * arguments did not ask for concurrency.
 */
public record PlanResponse(
        String       strategy,
        Integer      workers,
        Boolean      grouping,
        String       groupingScope,
        String       distributionMode,
        List<String> args
) {
    public static PlanResponse from(RewrittenArguments rewritten) {
        StrategyDecision d = rewritten.decision().orElse(null);
        if (d == null) {
            return new PlanResponse(null, null, null, null, null, rewritten.args());
        }
        return new PlanResponse(
                d.strategy().name(),
                d.workerCount(),
                d.groupingEnabled(),
                d.groupingEnabled() ? d.groupingScope().name() : null,
                rewritten.distributionMode().map(DistributionMode::name).orElse(null),
                rewritten.args());
    }
}
