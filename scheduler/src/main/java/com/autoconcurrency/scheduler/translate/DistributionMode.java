package com.autoconcurrency.scheduler.translate;

/**
 * How the isolated-process distributor spreads items over its workers.
 * The option value is what the distributor accepts for {@code --dist}.
 */
public enum DistributionMode {

    /** Any item to any free worker. */
    PER_ITEM("load"),

    /** All items of one file to the same worker. */
    PER_GROUP_FILE("loadfile"),

    /** All items sharing a group key (package scope) to the same worker. */
    PER_GROUP("loadgroup");

    private final String optionValue;

    DistributionMode(String optionValue) {
        this.optionValue = optionValue;
    }

    public String optionValue() {
        return optionValue;
    }
}
