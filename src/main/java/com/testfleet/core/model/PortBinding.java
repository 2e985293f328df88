package com.testfleet.core.model;

/**
 * A host address and port published for one container port.
 *
 * @param bindAddress   host interface the port is bound to (e.g. 127.0.0.1)
 * @param hostPort      port on the host
 * @param containerPort port inside the container
 */
public record PortBinding(
    String bindAddress,
    int hostPort,
    int containerPort
) {

    /** Host side of the binding as {@code address:port}. */
    public String hostKey() {
        return bindAddress + ":" + hostPort;
    }

    /** True for an address that binds every host interface. */
    public boolean isWildcard() {
        return bindAddress == null || bindAddress.isBlank()
                || "0.0.0.0".equals(bindAddress) || "::".equals(bindAddress);
    }

    /**
     * Whether both bindings cannot be published at once: same host port and either the same
     * address or a wildcard on one side.
     */
    public boolean clashesWith(PortBinding other) {
        if (hostPort != other.hostPort) {
            return false;
        }
        return isWildcard() || other.isWildcard() || bindAddress.equals(other.bindAddress);
    }

    /** Address a client on the host connects to; a wildcard bind is reached over loopback. */
    public String connectHost() {
        return bindAddress == null || bindAddress.isBlank() || "0.0.0.0".equals(bindAddress)
                ? "127.0.0.1"
                : bindAddress;
    }

    @Override
    public String toString() {
        return bindAddress + ":" + hostPort + "->" + containerPort;
    }
}
