package com.autoconcurrency.scheduler.model;

import java.util.List;

/**
 * Outcomes of one run, in original WorkItem submission order.
 *
 * @param strategy  the strategy that produced the outcomes
 * @param outcomes  one entry per submitted item; index i belongs to item i
 * @param cancelled true if the run was cancelled and some items were never dispatched
 */
public record RunReport(Strategy strategy, List<Outcome> outcomes, boolean cancelled) {

    public RunReport {
        outcomes = List.copyOf(outcomes);
    }

    public static RunReport empty(Strategy strategy) {
        return new RunReport(strategy, List.of(), false);
    }

    public int size() {
        return outcomes.size();
    }

    public Outcome get(int index) {
        return outcomes.get(index);
    }

    public long count(ItemStatus status) {
        return outcomes.stream().filter(o -> o.status() == status).count();
    }

    public boolean allPassed() {
        return outcomes.stream().allMatch(Outcome::passed);
    }

    public List<String> itemIds() {
        return outcomes.stream().map(Outcome::itemId).toList();
    }
}
