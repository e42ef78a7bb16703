package com.autoconcurrency.scheduler.backend.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Response from POST /runs. Outcomes may come back in any order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DistributorRunResponse(List<DistributorOutcome> outcomes) {}
