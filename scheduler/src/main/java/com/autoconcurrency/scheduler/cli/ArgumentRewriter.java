package com.autoconcurrency.scheduler.cli;

import com.autoconcurrency.scheduler.decision.StrategyDecision;
import com.autoconcurrency.scheduler.decision.StrategyOverride;
import com.autoconcurrency.scheduler.decision.StrategySelector;
import com.autoconcurrency.scheduler.model.Strategy;
import com.autoconcurrency.scheduler.probe.CapabilityProbe;
import com.autoconcurrency.scheduler.translate.DistributionMode;
import com.autoconcurrency.scheduler.translate.ParameterTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Replaces the concurrency options in an argument list with the arguments of
 * the backend the decision selects:
 * <pre>
 *   threaded          → --workers N
 *   isolated-process  → -n N [--dist loadfile|loadgroup]
 * </pre>
 */
@Component
public class ArgumentRewriter {

    private static final Logger log = LoggerFactory.getLogger(ArgumentRewriter.class);

    private final CapabilityProbe     probe;
    private final StrategySelector    selector;
    private final ParameterTranslator translator;

    public ArgumentRewriter(CapabilityProbe probe,
                            StrategySelector selector,
                            ParameterTranslator translator) {
        this.probe      = probe;
        this.selector   = selector;
        this.translator = translator;
    }

    public RewrittenArguments rewrite(List<String> args) {
        ParsedOptions parsed = ConcurrencyOptions.parse(args);
        if (parsed.override().isEmpty()) {
            return new RewrittenArguments(Optional.empty(), Optional.empty(), parsed.remainingArgs());
        }

        StrategyOverride override = parsed.override().get();
        int cores = probe.availableParallelism();
        if (parsed.debug()) {
            log.info("Decision inputs: cores={}, override={}, passthrough={}",
                    cores, override, parsed.remainingArgs());
        } else {
            log.debug("Decision inputs: cores={}, override={}", cores, override);
        }

        StrategyDecision decision = selector.decide(cores, override);
        List<String> rewritten = new ArrayList<>(parsed.remainingArgs());
        rewritten.addAll(translator.toArguments(decision));

        Optional<DistributionMode> mode = decision.strategy() == Strategy.ISOLATED_PROCESS
                ? Optional.of(translator.toDistributor(decision).distributionMode())
                : Optional.empty();

        log.info("Using {} workers with {} strategy", decision.workerCount(), decision.strategy());
        if (decision.groupingEnabled()) {
            log.info("Task grouping by {} enabled{}", decision.groupingScope().optionValue(),
                    mode.map(m -> " (--dist=" + m.optionValue() + ")").orElse(""));
        }
        return new RewrittenArguments(Optional.of(decision), mode, rewritten);
    }
}
