package com.autoconcurrency.scheduler.decision;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Requested worker count: either "auto" (one worker per available core) or an
 * explicit number. The number is validated by {@link StrategySelector}, not here,
 * so that a bad value is reported as part of the decision.
 */
public final class WorkerRequest {

    public static final String AUTO_VALUE = "auto";

    private static final WorkerRequest AUTO = new WorkerRequest(null);

    private final Integer count;

    private WorkerRequest(Integer count) {
        this.count = count;
    }

    public static WorkerRequest auto() {
        return AUTO;
    }

    public static WorkerRequest of(int count) {
        return new WorkerRequest(count);
    }

    /**
     * Parse an option value: "auto" or an integer.
     *
     * @throws InvalidConfigurationException if the value is neither
     */
    public static WorkerRequest parse(String value) {
        if (value == null || value.isBlank()) {
            throw new InvalidConfigurationException("Missing --concurrency value");
        }
        String trimmed = value.trim();
        if (AUTO_VALUE.equals(trimmed)) {
            return AUTO;
        }
        try {
            return of(Integer.parseInt(trimmed));
        } catch (NumberFormatException e) {
            throw new InvalidConfigurationException("Invalid --concurrency value: " + value, e);
        }
    }

    public boolean isAuto() {
        return count == null;
    }

    public OptionalInt count() {
        return count == null ? OptionalInt.empty() : OptionalInt.of(count);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof WorkerRequest other && Objects.equals(count, other.count);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(count);
    }

    @Override
    public String toString() {
        return count == null ? AUTO_VALUE : count.toString();
    }
}
