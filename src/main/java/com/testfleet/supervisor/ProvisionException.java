package com.testfleet.supervisor;

/**
 * A backend failed to launch or to become ready. By the time this is thrown
 * the supervisor has already stopped every instance of the batch.
 */
public class ProvisionException extends RuntimeException {

    private final String serviceName;

    public ProvisionException(String serviceName, String message) {
        super("Service " + serviceName + " failed to provision: " + message);
        this.serviceName = serviceName;
    }

    public ProvisionException(String serviceName, String message, Throwable cause) {
        super("Service " + serviceName + " failed to provision: " + message, cause);
        this.serviceName = serviceName;
    }

    public String serviceName() {
        return serviceName;
    }
}
