package com.testfleet.core.model;

/**
 * Runtime handle for one started {@link ServiceSpec}.
 *
 * <p>Owned by the supervisor that launched it. State changes may come from
 * the startup task and from a teardown running on another thread.
 */
public final class ServiceInstance {

    private final ServiceSpec spec;
    private final String handle;
    private volatile ServiceState state = ServiceState.STARTING;
    private volatile String failureCause;

    public ServiceInstance(ServiceSpec spec, String handle) {
        this.spec = spec;
        this.handle = handle;
    }

    public ServiceSpec spec() { return spec; }
    public String name() { return spec.name(); }
    public String handle() { return handle; }
    public ServiceState state() { return state; }
    public String failureCause() { return failureCause; }

    public synchronized void markReady() {
        if (state != ServiceState.STARTING) {
            throw new IllegalStateException(
                    "Service %s cannot become READY from %s".formatted(name(), state));
        }
        state = ServiceState.READY;
    }

    public synchronized void markFailed(String cause) {
        if (state != ServiceState.STARTING) {
            throw new IllegalStateException(
                    "Service %s cannot become FAILED from %s".formatted(name(), state));
        }
        failureCause = cause;
        state = ServiceState.FAILED;
    }

    /**
     * Moves to STOPPED from any state.
     *
     * @return false if the instance was already stopped
     */
    public synchronized boolean markStopped() {
        if (state == ServiceState.STOPPED) {
            return false;
        }
        state = ServiceState.STOPPED;
        return true;
    }

    @Override
    public String toString() {
        return "ServiceInstance[" + name() + ", " + handle + ", " + state + "]";
    }
}
