package com.autoconcurrency.scheduler.executor;

import java.util.List;

/**
 * Smallest batch handed to one worker: either a single item or every item of
 * one group, in submission order. Never empty.
 *
 * @param groupKey the shared group key; null for a singleton unit
 * @param items    members in submission order
 */
public record DispatchUnit(String groupKey, List<ScheduledItem> items) {

    public DispatchUnit {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("DispatchUnit must contain at least one item");
        }
        items = List.copyOf(items);
    }

    public static DispatchUnit single(ScheduledItem item) {
        return new DispatchUnit(null, List.of(item));
    }

    public int size() {
        return items.size();
    }

    public List<String> itemIds() {
        return items.stream().map(s -> s.item().id()).toList();
    }
}
