package com.autoconcurrency.scheduler.executor;

import com.autoconcurrency.scheduler.model.Outcome;
import com.autoconcurrency.scheduler.model.RunReport;
import com.autoconcurrency.scheduler.model.Strategy;
import com.autoconcurrency.scheduler.model.WorkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReferenceArray;

/**
 * Collects Outcomes from concurrent workers into one slot per submitted item.
 *
 * Slots are indexed by submission position, so the report comes out in
 * submission order without sorting. Each slot is written by exactly one
 * worker; the atomic array only provides visibility to the collecting thread
 * and catches a second write to the same slot.
 */
public class ResultAggregator {

    private final List<WorkItem>                items;
    private final AtomicReferenceArray<Outcome> slots;

    public ResultAggregator(List<WorkItem> items) {
        this.items = List.copyOf(items);
        this.slots = new AtomicReferenceArray<>(items.size());
    }

    /**
     * @throws IllegalStateException if the slot was already written, or the
     *                               outcome belongs to a different item
     */
    public void record(int position, Outcome outcome) {
        String expectedId = items.get(position).id();
        if (!expectedId.equals(outcome.itemId())) {
            throw new IllegalStateException("Outcome for '" + outcome.itemId()
                    + "' recorded at position " + position + " which holds '" + expectedId + "'");
        }
        if (!slots.compareAndSet(position, null, outcome)) {
            throw new IllegalStateException("Outcome for item '" + expectedId + "' recorded twice");
        }
    }

    public int completed() {
        int n = 0;
        for (int i = 0; i < slots.length(); i++) {
            if (slots.get(i) != null) n++;
        }
        return n;
    }

    /**
     * Build the final report.
     *
     * @param cancelled when true, empty slots become CANCELLED outcomes;
     *                  otherwise an empty slot is a scheduler bug
     * @throws IllegalStateException if a slot is empty and the run was not cancelled
     */
    public RunReport toReport(Strategy strategy, boolean cancelled) {
        List<Outcome> outcomes = new ArrayList<>(slots.length());
        boolean anyMissing = false;
        for (int i = 0; i < slots.length(); i++) {
            Outcome outcome = slots.get(i);
            if (outcome == null) {
                if (!cancelled) {
                    throw new IllegalStateException(
                            "No outcome recorded for item '" + items.get(i).id() + "'");
                }
                outcome = Outcome.cancelled(items.get(i).id());
                anyMissing = true;
            }
            outcomes.add(outcome);
        }
        return new RunReport(strategy, outcomes, anyMissing);
    }
}
