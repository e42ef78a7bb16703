package com.autoconcurrency.scheduler.backend.dto;

/**
 * One item in a distributor run request. group_key is null for ungrouped items.
 */
public record DistributorItem(String id, String group_key) {}
