package com.autoconcurrency.scheduler.backend.dto;

import java.util.List;

/**
 * Request body for POST /runs on the distributor.
 *
 * @param distribution_mode "load" | "loadfile" | "loadgroup"
 */
public record DistributorRunRequest(
        int workers,
        String distribution_mode,
        List<DistributorItem> items
) {}
