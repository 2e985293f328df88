package com.testfleet.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for pipeline runs.
 */
@Service
public class PipelineMetrics {

    private final MeterRegistry registry;

    public PipelineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordProvisioning(long ms, boolean success) {
        Timer.builder("testfleet.provisioning.duration")
                .tag("result", success ? "ready" : "failed")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records how long one backend took to pass its readiness probe.
     *
     * @param service  service name
     * @param attempts probe attempts used
     */
    public void recordReadiness(String service, long ms, int attempts) {
        Timer.builder("testfleet.service.readiness")
                .tag("service", service)
                .register(registry)
                .record(Duration.ofMillis(ms));
        Counter.builder("testfleet.service.probe_attempts")
                .tag("service", service)
                .register(registry)
                .increment(attempts);
    }

    public void recordPhase(String phase, String status, Duration duration) {
        Timer.builder("testfleet.phase.duration")
                .tag("phase", phase)
                .tag("status", status)
                .register(registry)
                .record(duration);
    }

    public void recordRunResult(String overallStatus) {
        Counter.builder("testfleet.runs.total")
                .tag("status", overallStatus)
                .register(registry)
                .increment();
    }

    public void recordFinalization(boolean acknowledged, int attempts) {
        Counter.builder("testfleet.finalization.calls")
                .description("Reporting webhook calls by outcome")
                .tag("result", acknowledged ? "acknowledged" : "failed")
                .tag("attempts", String.valueOf(attempts))
                .register(registry)
                .increment();
    }
}
