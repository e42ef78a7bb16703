package com.autoconcurrency.scheduler.service;

import com.autoconcurrency.scheduler.backend.IsolatedProcessBackend;
import com.autoconcurrency.scheduler.decision.StrategyDecision;
import com.autoconcurrency.scheduler.decision.StrategyOverride;
import com.autoconcurrency.scheduler.decision.StrategySelector;
import com.autoconcurrency.scheduler.executor.CancellationToken;
import com.autoconcurrency.scheduler.executor.ThreadedExecutor;
import com.autoconcurrency.scheduler.model.ItemStatus;
import com.autoconcurrency.scheduler.model.Outcome;
import com.autoconcurrency.scheduler.model.RunReport;
import com.autoconcurrency.scheduler.model.WorkItem;
import com.autoconcurrency.scheduler.translate.ParameterTranslator;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Entry point for the host framework: decide, translate, execute.
 *
 * <pre>
 *   probe → StrategySelector → ParameterTranslator → ThreadedExecutor
 *                                                  ↘ IsolatedProcessBackend
 * </pre>
 *
 * Every run is timed and every outcome counted:
 * <pre>
 *   autoconcurrency.run.duration{strategy}
 *   autoconcurrency.items{strategy, status}
 * </pre>
 */
@Service
public class ConcurrencyRunner {

    private static final Logger log = LoggerFactory.getLogger(ConcurrencyRunner.class);

    private final StrategySelector       selector;
    private final ParameterTranslator    translator;
    private final ThreadedExecutor       threadedExecutor;
    private final IsolatedProcessBackend backend;
    private final MeterRegistry          meterRegistry;

    public ConcurrencyRunner(StrategySelector selector,
                             ParameterTranslator translator,
                             ThreadedExecutor threadedExecutor,
                             IsolatedProcessBackend backend,
                             MeterRegistry meterRegistry) {
        this.selector         = selector;
        this.translator       = translator;
        this.threadedExecutor = threadedExecutor;
        this.backend          = backend;
        this.meterRegistry    = meterRegistry;
    }

    public RunReport run(List<WorkItem> items, StrategyOverride override) {
        return run(items, override, new CancellationToken());
    }

    /**
     * Decide a strategy and run every item under it.
     *
     * The decision is made before any item runs, so configuration errors
     * surface with nothing executed. Backend unavailability is rethrown as-is;
     * the run is never moved to the threaded executor behind the caller's back.
     *
     * @throws com.autoconcurrency.scheduler.decision.InvalidConfigurationException
     * @throws com.autoconcurrency.scheduler.backend.BackendUnavailableException
     */
    public RunReport run(List<WorkItem> items, StrategyOverride override, CancellationToken token) {
        StrategyDecision decision = selector.decide(override);
        log.info("Using {} workers with {} strategy for {} items",
                decision.workerCount(), decision.strategy(), items.size());

        String strategyTag = decision.strategy().name().toLowerCase(Locale.ROOT);
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            RunReport report = switch (decision.strategy()) {
                case THREADED -> threadedExecutor.execute(items, translator.toThreaded(decision), token);
                case ISOLATED_PROCESS -> backend.run(items, translator.toDistributor(decision));
            };
            record(report, strategyTag);
            return report;
        } finally {
            sample.stop(meterRegistry.timer("autoconcurrency.run.duration", "strategy", strategyTag));
        }
    }

    private void record(RunReport report, String strategyTag) {
        for (Outcome outcome : report.outcomes()) {
            meterRegistry.counter("autoconcurrency.items",
                    "strategy", strategyTag,
                    "status",   outcome.status().name().toLowerCase(Locale.ROOT)).increment();
        }
        log.info("Run finished: {} items, {} failed, {} errored{}",
                report.size(),
                report.count(ItemStatus.FAILED),
                report.count(ItemStatus.ERRORED),
                report.cancelled() ? " (cancelled)" : "");
    }
}
