package com.autoconcurrency.scheduler.api.dto;

import java.util.List;

/**
 * Request body for POST /plans: the runner's raw argument list.
 */
public record PlanRequest(List<String> args) {}
