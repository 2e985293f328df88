package com.testfleet.supervisor;

import com.testfleet.core.model.ServiceInstance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Application-level handshake: runs the spec's readiness command inside the
 * container (e.g. {@code pg_isready}) and treats exit code 0 as ready.
 */
public class ExecReadinessProbe implements ReadinessProbe {

    private static final Logger log = LoggerFactory.getLogger(ExecReadinessProbe.class);

    private final ServiceProvider provider;
    private final Duration commandTimeout;

    public ExecReadinessProbe(ServiceProvider provider, Duration commandTimeout) {
        this.provider = provider;
        this.commandTimeout = commandTimeout;
    }

    @Override
    public boolean check(ServiceInstance instance) {
        var command = instance.spec().readiness().command();
        try {
            int exit = provider.exec(instance.handle(), command, commandTimeout);
            if (exit != 0) {
                log.debug("Readiness command for {} exited with {}", instance.name(), exit);
            }
            return exit == 0;
        } catch (RuntimeException e) {
            log.debug("Readiness command for {} failed: {}", instance.name(), e.getMessage());
            return false;
        }
    }
}
