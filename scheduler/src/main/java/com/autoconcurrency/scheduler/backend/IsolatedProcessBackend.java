package com.autoconcurrency.scheduler.backend;

import com.autoconcurrency.scheduler.model.RunReport;
import com.autoconcurrency.scheduler.model.WorkItem;
import com.autoconcurrency.scheduler.translate.DistributorParameters;

import java.util.List;

/**
 * External distributor that runs items in separate processes.
 *
 * Only the item ids and group keys cross this boundary; the distributor
 * locates and executes the items itself and is trusted to honour the
 * worker count and distribution mode it is given.
 */
public interface IsolatedProcessBackend {

    /** Name used in diagnostics, e.g. in {@link BackendUnavailableException}. */
    String name();

    /**
     * Run the items and return one outcome per item, in submission order.
     *
     * @throws BackendUnavailableException if the backend cannot be invoked
     * @throws DistributorException        if it fails or returns an incomplete report
     */
    RunReport run(List<WorkItem> items, DistributorParameters params);
}
