package com.testfleet.supervisor;

import com.testfleet.core.model.ServiceSpec;

import java.time.Duration;

/**
 * Picks the probe implementation for a spec's readiness type.
 */
public class ReadinessProbes {

    private static final ReadinessProbe ALWAYS_READY = instance -> true;

    private final ReadinessProbe tcp;
    private final ReadinessProbe exec;

    public ReadinessProbes(ReadinessProbe tcp, ReadinessProbe exec) {
        this.tcp = tcp;
        this.exec = exec;
    }

    public static ReadinessProbes defaults(ServiceProvider provider) {
        return new ReadinessProbes(
                new TcpReadinessProbe(Duration.ofSeconds(1)),
                new ExecReadinessProbe(provider, Duration.ofSeconds(15)));
    }

    public ReadinessProbe forSpec(ServiceSpec spec) {
        return switch (spec.readiness().type()) {
            case TCP -> tcp;
            case EXEC -> exec;
            case NONE -> ALWAYS_READY;
        };
    }
}
