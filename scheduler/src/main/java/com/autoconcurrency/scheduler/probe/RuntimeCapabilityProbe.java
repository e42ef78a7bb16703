package com.autoconcurrency.scheduler.probe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.function.IntSupplier;

/**
 * {@link CapabilityProbe} backed by {@link Runtime#availableProcessors()}.
 *
 * The JVM already honours container CPU quotas, so no cgroup parsing is
 * done here.
 */
@Component
public class RuntimeCapabilityProbe implements CapabilityProbe {

    private static final Logger log = LoggerFactory.getLogger(RuntimeCapabilityProbe.class);

    private final IntSupplier source;

    public RuntimeCapabilityProbe() {
        this(() -> Runtime.getRuntime().availableProcessors());
    }

    RuntimeCapabilityProbe(IntSupplier source) {
        this.source = source;
    }

    @Override
    public int availableParallelism() {
        int reported;
        try {
            reported = source.getAsInt();
        } catch (RuntimeException e) {
            log.warn("Could not read processor count, assuming 1: {}", e.getMessage());
            return 1;
        }
        if (reported < 1) {
            log.warn("Host reported {} processors, assuming 1", reported);
            return 1;
        }
        return reported;
    }
}
