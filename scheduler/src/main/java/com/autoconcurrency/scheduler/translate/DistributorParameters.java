package com.autoconcurrency.scheduler.translate;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything the isolated-process distributor is told about a run.
 *
 * @param workers          number of worker processes, at least 1
 * @param distributionMode how items are spread over them
 */
public record DistributorParameters(int workers, DistributionMode distributionMode) {

    /** Distributor command-line form: {@code -n N [--dist mode]}. */
    public List<String> toArguments() {
        List<String> args = new ArrayList<>(List.of("-n", String.valueOf(workers)));
        if (distributionMode != DistributionMode.PER_ITEM) {
            args.add("--dist");
            args.add(distributionMode.optionValue());
        }
        return args;
    }
}
