package com.testfleet.supervisor;

import com.testfleet.core.model.ServiceSpec;

import java.time.Duration;
import java.util.List;

/**
 * Abstraction over the container runtime that hosts backend services.
 * Implementation: {@link DockerServiceProvider}.
 */
public interface ServiceProvider {

    /**
     * Creates and starts the process for a spec.
     * @return an opaque handle (the container ID)
     */
    String launch(ServiceSpec spec);

    /**
     * Whether the process behind the handle is still running.
     */
    boolean isRunning(String handle);

    /**
     * Runs a command inside the running service.
     * @return the command's exit code, or -1 if it did not finish within the timeout
     */
    int exec(String handle, List<String> command, Duration timeout);

    /**
     * Captures the tail of stdout/stderr, used when a service fails to start.
     */
    String captureOutput(String handle);

    /**
     * Asks the process to shut down, waits up to the grace period, then forces
     * termination and removes it. Must tolerate handles that are already gone.
     */
    void stop(String handle, int graceSeconds);
}
