package com.autoconcurrency.scheduler.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Per-item result reported by the distributor.
 *
 * @param status "passed" | "failed" | "error" | "errored"
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DistributorOutcome(
        String item_id,
        String status,
        String detail
) {}
