package com.autoconcurrency.scheduler.translate;

import com.autoconcurrency.scheduler.decision.StrategyDecision;
import com.autoconcurrency.scheduler.model.GroupingScope;
import com.autoconcurrency.scheduler.model.Strategy;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a {@link StrategyDecision} into the parameters of whichever backend
 * will run the items. Pure mapping; nothing is executed here.
 */
@Component
public class ParameterTranslator {

    /**
     * Parameters for the isolated-process distributor.
     *
     * @throws IllegalArgumentException if the decision is not ISOLATED_PROCESS
     */
    public DistributorParameters toDistributor(StrategyDecision decision) {
        requireStrategy(decision, Strategy.ISOLATED_PROCESS);
        return new DistributorParameters(decision.workerCount(), distributionMode(decision));
    }

    /**
     * Parameters for the in-process executor; grouping passes straight through.
     *
     * @throws IllegalArgumentException if the decision is not THREADED
     */
    public ThreadedParameters toThreaded(StrategyDecision decision) {
        requireStrategy(decision, Strategy.THREADED);
        return new ThreadedParameters(decision.workerCount(), decision.groupingEnabled());
    }

    /** Backend command-line arguments for either strategy. */
    public List<String> toArguments(StrategyDecision decision) {
        return decision.strategy() == Strategy.THREADED
                ? toThreaded(decision).toArguments()
                : toDistributor(decision).toArguments();
    }

    static DistributionMode distributionMode(StrategyDecision decision) {
        if (!decision.groupingEnabled()) {
            return DistributionMode.PER_ITEM;
        }
        return decision.groupingScope() == GroupingScope.PACKAGE
                ? DistributionMode.PER_GROUP
                : DistributionMode.PER_GROUP_FILE;
    }

    private static void requireStrategy(StrategyDecision decision, Strategy expected) {
        if (decision.strategy() != expected) {
            throw new IllegalArgumentException(
                    "Expected a " + expected + " decision but got " + decision.strategy());
        }
    }
}
