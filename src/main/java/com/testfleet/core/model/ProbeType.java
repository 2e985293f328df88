package com.testfleet.core.model;

/**
 * Kind of readiness check run against a starting backend.
 */
public enum ProbeType {
    TCP,        // connect to the published host port
    EXEC,       // run a handshake command inside the container
    NONE
}
