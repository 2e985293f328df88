package com.testfleet.core.model;

/**
 * What the container runtime does when a backend process exits on its own.
 */
public enum RestartPolicy {
    NEVER,
    ALWAYS
}
