package com.testfleet.core.model;

/**
 * Lifecycle state of a provisioned backend.
 */
public enum ServiceState {
    STARTING,
    READY,
    FAILED,
    STOPPED
}
