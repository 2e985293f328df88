package com.testfleet.core.model;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Declarative description of one backend service to provision for a pipeline run.
 */
public record ServiceSpec(
    String name,
    String image,
    List<String> command,
    List<PortBinding> ports,
    Map<String, String> env,
    RestartPolicy restartPolicy,
    ReadinessSpec readiness
) {
    public ServiceSpec {
        command = command != null ? List.copyOf(command) : List.of();
        ports = ports != null ? List.copyOf(ports) : List.of();
        env = env != null ? Map.copyOf(env) : Map.of();
        restartPolicy = restartPolicy != null ? restartPolicy : RestartPolicy.NEVER;
        readiness = readiness != null ? readiness : ReadinessSpec.none();
    }

    /**
     * Returns the host binding published for a container port, if any.
     */
    public Optional<PortBinding> bindingFor(int containerPort) {
        return ports.stream()
                .filter(p -> p.containerPort() == containerPort)
                .findFirst();
    }
}
