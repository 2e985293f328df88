package com.testfleet.supervisor;

import com.testfleet.core.events.EventBus;
import com.testfleet.core.events.PipelineEvent;
import com.testfleet.core.logging.MdcContext;
import com.testfleet.core.metrics.PipelineMetrics;
import com.testfleet.core.model.ServiceInstance;
import com.testfleet.core.model.ServiceSpec;
import com.testfleet.core.model.ServiceState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Owns the lifecycle of the backend services of one pipeline run.
 *
 * <p>Services have no dependencies on each other, so {@link #start} launches
 * them all at once and probes them concurrently: provisioning takes as long as
 * the slowest backend, not the sum. A batch is all or nothing; if one backend
 * fails, every container of the batch is stopped before the error surfaces.
 */
public class ServiceSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ServiceSupervisor.class);

    private final ServiceProvider provider;
    private final ReadinessProbes probes;
    private final ExecutorService executor;
    private final int stopGraceSeconds;
    private final EventBus eventBus;
    private final PipelineMetrics metrics;

    public ServiceSupervisor(ServiceProvider provider, ReadinessProbes probes, ExecutorService executor,
                             int stopGraceSeconds, EventBus eventBus, PipelineMetrics metrics) {
        this.provider = provider;
        this.probes = probes;
        this.executor = executor;
        this.stopGraceSeconds = stopGraceSeconds;
        this.eventBus = eventBus;
        this.metrics = metrics;
    }

    /**
     * Launches every spec concurrently and blocks until each one is ready or failed.
     *
     * @param runId run the services belong to (for logging and events)
     * @param specs specs in declaration order
     * @return instances keyed by service name, in declaration order, all READY
     * @throws ProvisionException for the first failed spec in declaration order,
     *                            after the whole batch has been stopped
     */
    public Map<String, ServiceInstance> start(String runId, List<ServiceSpec> specs) {
        long startMs = System.currentTimeMillis();
        log.info("Provisioning {} services: {}", specs.size(),
                specs.stream().map(ServiceSpec::name).toList());

        var launched = new ConcurrentHashMap<String, ServiceInstance>();
        var futures = new LinkedHashMap<String, CompletableFuture<ServiceInstance>>();
        for (var spec : specs) {
            futures.put(spec.name(), CompletableFuture.supplyAsync(
                    () -> bringUp(runId, spec, launched), executor));
        }

        ProvisionException failure = null;
        for (var entry : futures.entrySet()) {
            String name = entry.getKey();
            try {
                var instance = entry.getValue().join();
                if (instance.state() == ServiceState.FAILED && failure == null) {
                    failure = new ProvisionException(name, instance.failureCause());
                }
            } catch (CompletionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                log.error("Service {} could not be launched", name, cause);
                if (failure == null) {
                    failure = cause instanceof ProvisionException pe
                            ? pe
                            : new ProvisionException(name, String.valueOf(cause.getMessage()), cause);
                }
            }
        }

        var ordered = new LinkedHashMap<String, ServiceInstance>();
        for (var spec : specs) {
            var instance = launched.get(spec.name());
            if (instance != null) {
                ordered.put(spec.name(), instance);
            }
        }

        long elapsedMs = System.currentTimeMillis() - startMs;
        if (metrics != null) {
            metrics.recordProvisioning(elapsedMs, failure == null);
        }

        if (failure != null) {
            log.error("Provisioning failed on {}; rolling back {} launched services",
                    failure.serviceName(), ordered.size());
            stop(runId, ordered);
            throw failure;
        }

        log.info("All {} services ready in {}ms", ordered.size(), elapsedMs);
        return Collections.unmodifiableMap(ordered);
    }

    public void stop(Map<String, ServiceInstance> instances) {
        stop(null, instances);
    }

    /**
     * Stops every instance regardless of its state. Already stopped instances
     * are skipped, so calling this twice is harmless. Never throws.
     */
    public void stop(String runId, Map<String, ServiceInstance> instances) {
        var futures = new ArrayList<CompletableFuture<Void>>();
        for (var instance : instances.values()) {
            if (!instance.markStopped()) {
                log.debug("Service {} already stopped", instance.name());
                continue;
            }
            futures.add(CompletableFuture.runAsync(() -> {
                try {
                    provider.stop(instance.handle(), stopGraceSeconds);
                    log.info("Service {} stopped", instance.name());
                } catch (RuntimeException e) {
                    log.error("Service {} (handle {}) could not be stopped; it may still be running",
                            instance.name(), instance.handle(), e);
                }
                publish(runId, "service.stopped", instance.name(), Map.of());
            }, executor));
        }
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    }

    private ServiceInstance bringUp(String runId, ServiceSpec spec, Map<String, ServiceInstance> launched) {
        MdcContext.setService(runId, spec.name());
        try {
            publish(runId, "service.starting", spec.name(), Map.of("image", spec.image()));
            String handle = provider.launch(spec);
            var instance = new ServiceInstance(spec, handle);
            launched.put(spec.name(), instance);
            awaitReady(runId, instance);
            return instance;
        } finally {
            MdcContext.clear();
        }
    }

    /**
     * Polls the spec's probe at a fixed interval until it passes, the process
     * exits, or the attempts run out.
     */
    void awaitReady(String runId, ServiceInstance instance) {
        var readiness = instance.spec().readiness();
        var probe = probes.forSpec(instance.spec());
        long startMs = System.currentTimeMillis();

        for (int attempt = 1; attempt <= readiness.maxAttempts(); attempt++) {
            boolean running;
            try {
                running = provider.isRunning(instance.handle());
            } catch (RuntimeException e) {
                fail(runId, instance, "could not inspect process: " + e.getMessage());
                return;
            }
            if (!running) {
                fail(runId, instance, "process exited before becoming ready");
                return;
            }
            if (probe.check(instance)) {
                instance.markReady();
                long elapsedMs = System.currentTimeMillis() - startMs;
                log.info("Service {} ready after {} attempt(s), {}ms", instance.name(), attempt, elapsedMs);
                if (metrics != null) {
                    metrics.recordReadiness(instance.name(), elapsedMs, attempt);
                }
                publish(runId, "service.ready", instance.name(),
                        Map.of("attempts", attempt, "elapsedMs", elapsedMs));
                return;
            }
            if (attempt < readiness.maxAttempts() && !sleep(readiness.interval())) {
                fail(runId, instance, "interrupted while waiting for readiness");
                return;
            }
        }
        fail(runId, instance, "readiness timed out after " + readiness.maxAttempts() + " attempts");
    }

    private void fail(String runId, ServiceInstance instance, String cause) {
        instance.markFailed(cause);
        String output;
        try {
            output = provider.captureOutput(instance.handle());
        } catch (RuntimeException e) {
            output = "<unavailable: " + e.getMessage() + ">";
        }
        log.warn("Service {} failed: {}. Last output:\n{}", instance.name(), cause, output);
        publish(runId, "service.failed", instance.name(), Map.of("cause", cause));
    }

    private static boolean sleep(Duration interval) {
        try {
            Thread.sleep(interval.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void publish(String runId, String type, String service, Map<String, Object> payload) {
        if (eventBus != null) {
            eventBus.publish(PipelineEvent.of(type, runId, service, payload));
        }
    }
}
