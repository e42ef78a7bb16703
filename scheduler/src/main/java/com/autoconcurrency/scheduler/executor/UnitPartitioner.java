package com.autoconcurrency.scheduler.executor;

import com.autoconcurrency.scheduler.model.WorkItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Splits a run's items into {@link DispatchUnit}s.
 *
 * Without grouping every item is its own unit. With grouping, items are
 * bucketed by group key in one pass; each unit appears at the position of its
 * key's first occurrence and keeps its members in submission order. Items
 * without a group key get a bucket of their own.
 */
public final class UnitPartitioner {

    // Ungrouped items are keyed by position so they can never share a bucket.
    private record BucketKey(String groupKey, int position) {}

    private UnitPartitioner() {}

    public static List<DispatchUnit> partition(List<WorkItem> items, boolean groupingEnabled) {
        if (!groupingEnabled) {
            List<DispatchUnit> units = new ArrayList<>(items.size());
            for (int i = 0; i < items.size(); i++) {
                units.add(DispatchUnit.single(new ScheduledItem(i, items.get(i))));
            }
            return units;
        }

        Map<BucketKey, List<ScheduledItem>> buckets = new LinkedHashMap<>();
        for (int i = 0; i < items.size(); i++) {
            WorkItem item = items.get(i);
            BucketKey key = item.hasGroup()
                    ? new BucketKey(item.groupKey(), -1)
                    : new BucketKey(null, i);
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(new ScheduledItem(i, item));
        }

        List<DispatchUnit> units = new ArrayList<>(buckets.size());
        buckets.forEach((key, members) -> units.add(new DispatchUnit(key.groupKey(), members)));
        return units;
    }
}
