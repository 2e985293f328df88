package com.testfleet.core.model;

/**
 * Aggregate test outcome of a pipeline run.
 */
public enum OverallStatus {
    PENDING,
    SUCCESS,
    PARTIAL_FAILURE,
    ABORTED
}
