package com.testfleet.core.model;

public enum PhaseStatus {
    SUCCESS,
    FAILURE,
    SKIPPED
}
