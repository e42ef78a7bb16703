package com.autoconcurrency.scheduler.decision;

/**
 * User intent for the strategy. AUTO lets the core count decide.
 */
public enum StrategyMode {
    AUTO,
    FORCE_THREADED,
    FORCE_ISOLATED_PROCESS
}
