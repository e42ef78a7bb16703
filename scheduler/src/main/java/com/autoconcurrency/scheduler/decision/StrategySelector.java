package com.autoconcurrency.scheduler.decision;

import com.autoconcurrency.scheduler.model.Strategy;
import com.autoconcurrency.scheduler.probe.CapabilityProbe;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Maps host capability plus user overrides to a {@link StrategyDecision}.
 *
 * Precedence, first match wins:
 * <ol>
 *   <li>FORCE_THREADED          → THREADED</li>
 *   <li>FORCE_ISOLATED_PROCESS  → ISOLATED_PROCESS</li>
 *   <li>AUTO: cores ≤ threshold → THREADED, otherwise ISOLATED_PROCESS</li>
 * </ol>
 * With few cores, threads sharing one JVM overlap waiting work more cheaply than
 * separate processes; with more cores, process start-up cost is absorbed.
 */
@Component
public class StrategySelector {

    public static final int DEFAULT_AUTO_THRESHOLD = 2;

    private final CapabilityProbe probe;
    private final int             autoThreshold;

    public StrategySelector(
            CapabilityProbe probe,
            @Value("${autoconcurrency.auto-threshold:2}") int autoThreshold) {
        this.probe         = probe;
        this.autoThreshold = autoThreshold;
    }

    /** Decide using the probe's current reading. */
    public StrategyDecision decide(StrategyOverride override) {
        return decide(probe.availableParallelism(), override);
    }

    /**
     * Pure decision for a given core count.
     *
     * @throws InvalidConfigurationException if an explicit worker count is not positive
     */
    public StrategyDecision decide(int coreCount, StrategyOverride override) {
        int cores = Math.max(1, coreCount);

        Strategy strategy = switch (override.mode()) {
            case FORCE_THREADED         -> Strategy.THREADED;
            case FORCE_ISOLATED_PROCESS -> Strategy.ISOLATED_PROCESS;
            case AUTO -> cores <= autoThreshold ? Strategy.THREADED : Strategy.ISOLATED_PROCESS;
        };

        return new StrategyDecision(
                strategy,
                resolveWorkers(cores, override.workers()),
                override.groupingRequested(),
                override.groupingScope());
    }

    private static int resolveWorkers(int cores, WorkerRequest requested) {
        if (requested.isAuto()) {
            return cores;
        }
        int count = requested.count().getAsInt();
        if (count <= 0) {
            throw new InvalidConfigurationException(
                    "Worker count must be a positive integer or 'auto', was " + count);
        }
        return count;
    }
}
