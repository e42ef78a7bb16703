package com.autoconcurrency.scheduler.model;

import java.util.Objects;

/**
 * One unit of work supplied by the host framework.
 *
 * The scheduler only reads {@link #id()} and {@link #groupKey()} and invokes
 * {@link #body()}. A null or empty group key means the item has no group
 * affinity and may run on any worker.
 *
 * @param id       stable identifier, reported back in the Outcome
 * @param groupKey items sharing this key run sequentially on one worker
 *                 when grouping is enabled; null when ungrouped
 * @param body     the work itself
 */
public record WorkItem(String id, String groupKey, Body body) {

    /**
     * The executable part of a WorkItem. Throwing an {@link AssertionError}
     * marks the item FAILED; any other throwable marks it ERRORED.
     */
    @FunctionalInterface
    public interface Body {
        void run() throws Exception;
    }

    public WorkItem {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(body, "body");
        if (groupKey != null && groupKey.isEmpty()) {
            groupKey = null;
        }
    }

    public static WorkItem of(String id, Body body) {
        return new WorkItem(id, null, body);
    }

    public static WorkItem grouped(String id, String groupKey, Body body) {
        return new WorkItem(id, groupKey, body);
    }

    /** Builds an item whose group key is derived from its node id. */
    public static WorkItem fromNodeId(String nodeId, GroupingScope scope, Body body) {
        return new WorkItem(nodeId, scope.groupKeyOf(nodeId), body);
    }

    public boolean hasGroup() {
        return groupKey != null;
    }
}
