package com.autoconcurrency.scheduler.executor;

import com.autoconcurrency.scheduler.model.WorkItem;

/**
 * A WorkItem together with its submission position, which is the slot its
 * Outcome is written to.
 */
public record ScheduledItem(int position, WorkItem item) {}
