package com.testfleet.supervisor;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.api.async.ResultCallback;
import com.github.dockerjava.api.command.PullImageResultCallback;
import com.github.dockerjava.api.exception.NotFoundException;
import com.github.dockerjava.api.exception.NotModifiedException;
import com.github.dockerjava.api.model.ExposedPort;
import com.github.dockerjava.api.model.Frame;
import com.github.dockerjava.api.model.HostConfig;
import com.github.dockerjava.api.model.Ports;
import com.github.dockerjava.core.command.LogContainerResultCallback;
import com.testfleet.core.model.RestartPolicy;
import com.testfleet.core.model.ServiceSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Docker-based ServiceProvider. Each backend runs as one container.
 *
 * <p>Each container is configured with:
 * <ul>
 *   <li>Name {@code <prefix>-<service>}, so a leftover from a crashed run is replaced</li>
 *   <li>Labels identifying the service, for manual cleanup with {@code docker ps --filter}</li>
 *   <li>The spec's environment, command override and port bindings</li>
 *   <li>Restart policy {@code always} or {@code no}</li>
 * </ul>
 */
public class DockerServiceProvider implements ServiceProvider {

    private static final Logger log = LoggerFactory.getLogger(DockerServiceProvider.class);

    static final String SERVICE_LABEL = "testfleet.service";
    private static final int PULL_TIMEOUT_MINUTES = 10;
    private static final int OUTPUT_TAIL_LINES = 50;

    private final DockerClient dockerClient;
    private final String containerPrefix;
    private final boolean pullMissingImages;

    public DockerServiceProvider(DockerClient dockerClient, String containerPrefix, boolean pullMissingImages) {
        this.dockerClient = dockerClient;
        this.containerPrefix = containerPrefix != null ? containerPrefix : "testfleet";
        this.pullMissingImages = pullMissingImages;
    }

    @Override
    public String launch(ServiceSpec spec) {
        String containerName = containerName(spec.name());
        ensureImage(spec);

        log.info("Launching {} (image: {}, ports: {})", containerName, spec.image(), spec.ports());

        // Replace a stale container left behind by an earlier run
        try {
            dockerClient.removeContainerCmd(containerName).withForce(true).exec();
            log.debug("Removed stale container {}", containerName);
        } catch (NotFoundException e) {
            log.trace("No stale container named {}", containerName);
        }

        var envList = new ArrayList<String>();
        spec.env().forEach((k, v) -> envList.add(k + "=" + v));

        var exposedPorts = new ArrayList<ExposedPort>();
        var bindings = new Ports();
        for (var port : spec.ports()) {
            var exposed = ExposedPort.tcp(port.containerPort());
            exposedPorts.add(exposed);
            bindings.bind(exposed, Ports.Binding.bindIpAndPort(port.bindAddress(), port.hostPort()));
        }

        var hostConfig = HostConfig.newHostConfig()
                .withPortBindings(bindings)
                .withRestartPolicy(spec.restartPolicy() == RestartPolicy.ALWAYS
                        ? com.github.dockerjava.api.model.RestartPolicy.alwaysRestart()
                        : com.github.dockerjava.api.model.RestartPolicy.noRestart());

        var create = dockerClient.createContainerCmd(spec.image())
                .withName(containerName)
                .withHostConfig(hostConfig)
                .withEnv(envList)
                .withExposedPorts(exposedPorts)
                .withLabels(Map.of(SERVICE_LABEL, spec.name()));
        if (!spec.command().isEmpty()) {
            create = create.withCmd(spec.command());
        }

        String containerId = create.exec().getId();
        try {
            dockerClient.startContainerCmd(containerId).exec();
        } catch (RuntimeException e) {
            // Created but never started: remove it so the failed launch leaves nothing behind
            stop(containerId, 0);
            throw new ProvisionException(spec.name(), "container failed to start: " + e.getMessage(), e);
        }
        log.info("Service {} started (container {})", spec.name(), containerId);
        return containerId;
    }

    @Override
    public boolean isRunning(String handle) {
        try {
            var state = dockerClient.inspectContainerCmd(handle).exec().getState();
            return state != null && Boolean.TRUE.equals(state.getRunning());
        } catch (NotFoundException e) {
            return false;
        }
    }

    @Override
    public int exec(String handle, List<String> command, Duration timeout) {
        var created = dockerClient.execCreateCmd(handle)
                .withCmd(command.toArray(new String[0]))
                .withAttachStdout(true)
                .withAttachStderr(true)
                .exec();
        try {
            boolean finished = dockerClient.execStartCmd(created.getId())
                    .exec(new ResultCallback.Adapter<Frame>())
                    .awaitCompletion(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!finished) {
                log.debug("Exec {} in {} did not finish within {}", command, handle, timeout);
                return -1;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return -1;
        }
        Long exitCode = dockerClient.inspectExecCmd(created.getId()).exec().getExitCodeLong();
        return exitCode != null ? exitCode.intValue() : -1;
    }

    @Override
    public String captureOutput(String handle) {
        var sb = new StringBuilder();
        try {
            dockerClient.logContainerCmd(handle)
                    .withStdOut(true)
                    .withStdErr(true)
                    .withFollowStream(false)
                    .withTail(OUTPUT_TAIL_LINES)
                    .exec(new LogContainerResultCallback() {
                        @Override
                        public void onNext(Frame frame) {
                            sb.append(new String(frame.getPayload()));
                        }
                    }).awaitCompletion(30, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Interrupted while capturing output from container {}", handle);
        } catch (NotFoundException e) {
            log.debug("Container {} is gone, no output to capture", handle);
        }
        return sb.toString();
    }

    @Override
    public void stop(String handle, int graceSeconds) {
        try {
            dockerClient.stopContainerCmd(handle).withTimeout(graceSeconds).exec();
        } catch (NotModifiedException | NotFoundException e) {
            log.debug("Container {} already stopped: {}", handle, e.getMessage());
        } catch (Exception e) {
            log.warn("Graceful stop of container {} failed, forcing removal: {}", handle, e.getMessage());
        }
        try {
            dockerClient.removeContainerCmd(handle).withForce(true).withRemoveVolumes(true).exec();
            log.info("Container {} removed", handle);
        } catch (NotFoundException e) {
            log.debug("Container {} already removed", handle);
        } catch (Exception e) {
            log.warn("Failed to remove container {}", handle, e);
        }
    }

    String containerName(String serviceName) {
        return containerPrefix + "-" + serviceName;
    }

    private void ensureImage(ServiceSpec spec) {
        String image = spec.image();
        try {
            dockerClient.inspectImageCmd(image).exec();
            return;
        } catch (NotFoundException e) {
            if (!pullMissingImages) {
                throw new ProvisionException(spec.name(), "image " + image + " not present locally and pulling is disabled", e);
            }
        }
        log.info("Pulling image {}", image);
        try {
            boolean done = dockerClient.pullImageCmd(image)
                    .exec(new PullImageResultCallback())
                    .awaitCompletion(PULL_TIMEOUT_MINUTES, TimeUnit.MINUTES);
            if (!done) {
                throw new ProvisionException(spec.name(),
                        "pull of " + image + " did not finish within " + PULL_TIMEOUT_MINUTES + " minutes");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProvisionException(spec.name(), "interrupted while pulling " + image, e);
        }
    }
}
