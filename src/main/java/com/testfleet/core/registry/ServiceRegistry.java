package com.testfleet.core.registry;

import com.testfleet.core.config.TestfleetProperties;
import com.testfleet.core.model.PortBinding;
import com.testfleet.core.model.ProbeType;
import com.testfleet.core.model.ReadinessSpec;
import com.testfleet.core.model.RestartPolicy;
import com.testfleet.core.model.ServiceSpec;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, immutable set of backend service specs.
 *
 * <p>Construction rejects duplicate names and duplicate host bindings so that
 * no two containers can race for the same port once provisioning starts.
 */
public final class ServiceRegistry {

    static final String DEFAULT_BIND_ADDRESS = "127.0.0.1";

    private final Map<String, ServiceSpec> specs;

    public ServiceRegistry(List<ServiceSpec> specs) {
        var problems = validate(specs);
        if (!problems.isEmpty()) {
            throw new RegistryValidationException(problems);
        }
        var byName = new LinkedHashMap<String, ServiceSpec>();
        specs.forEach(s -> byName.put(s.name(), s));
        this.specs = Collections.unmodifiableMap(byName);
    }

    /** Specs in declaration order. */
    public List<ServiceSpec> specs() {
        return List.copyOf(specs.values());
    }

    public Optional<ServiceSpec> find(String name) {
        return Optional.ofNullable(specs.get(name));
    }

    public int size() {
        return specs.size();
    }

    /**
     * Builds a registry from the {@code testfleet.services} configuration list.
     */
    public static ServiceRegistry fromProperties(List<TestfleetProperties.Service> declared) {
        var problems = new ArrayList<String>();
        var specs = new ArrayList<ServiceSpec>();
        for (var svc : declared) {
            try {
                specs.add(toSpec(svc));
            } catch (IllegalArgumentException e) {
                problems.add(e.getMessage());
            }
        }
        if (!problems.isEmpty()) {
            throw new RegistryValidationException(problems);
        }
        return new ServiceRegistry(specs);
    }

    static ServiceSpec toSpec(TestfleetProperties.Service svc) {
        String name = svc.getName();
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("service without a name (image " + svc.getImage() + ")");
        }
        var ports = new ArrayList<PortBinding>();
        for (String raw : svc.getPorts()) {
            ports.add(parsePort(name, raw));
        }
        return new ServiceSpec(
                name,
                svc.getImage(),
                svc.getCommand(),
                ports,
                svc.getEnv(),
                parseRestart(name, svc.getRestart()),
                toReadiness(name, svc.getReadiness(), ports)
        );
    }

    /**
     * Parses compose short syntax: {@code containerPort}, {@code hostPort:containerPort}
     * or {@code bindAddress:hostPort:containerPort}. Addresses default to loopback.
     */
    static PortBinding parsePort(String service, String raw) {
        String[] parts = raw.trim().split(":");
        try {
            return switch (parts.length) {
                case 1 -> new PortBinding(DEFAULT_BIND_ADDRESS,
                        Integer.parseInt(parts[0]), Integer.parseInt(parts[0]));
                case 2 -> new PortBinding(DEFAULT_BIND_ADDRESS,
                        Integer.parseInt(parts[0]), Integer.parseInt(parts[1]));
                case 3 -> new PortBinding(parts[0],
                        Integer.parseInt(parts[1]), Integer.parseInt(parts[2]));
                default -> throw new IllegalArgumentException(
                        "service %s: unparseable port '%s'".formatted(service, raw));
            };
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "service %s: unparseable port '%s'".formatted(service, raw));
        }
    }

    private static RestartPolicy parseRestart(String service, String raw) {
        if (raw == null || raw.isBlank()) {
            return RestartPolicy.NEVER;
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "never", "no" -> RestartPolicy.NEVER;
            case "always" -> RestartPolicy.ALWAYS;
            default -> throw new IllegalArgumentException(
                    "service %s: unknown restart policy '%s'".formatted(service, raw));
        };
    }

    private static ReadinessSpec toReadiness(String service, TestfleetProperties.Readiness r,
                                             List<PortBinding> ports) {
        if (r == null) {
            return ports.isEmpty()
                    ? ReadinessSpec.none()
                    : ReadinessSpec.tcp(ports.get(0).containerPort(), Duration.ofSeconds(2), 30);
        }
        ProbeType type;
        try {
            type = ProbeType.valueOf(r.getType().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException(
                    "service %s: unknown readiness type '%s'".formatted(service, r.getType()));
        }
        int port = r.getPort();
        if (type == ProbeType.TCP && port == 0 && !ports.isEmpty()) {
            port = ports.get(0).containerPort();
        }
        return new ReadinessSpec(type, port, r.getCommand(), r.getInterval(), r.getMaxAttempts());
    }

    static List<String> validate(List<ServiceSpec> specs) {
        var problems = new ArrayList<String>();
        var names = new HashMap<String, Integer>();
        var claimed = new ArrayList<Map.Entry<PortBinding, String>>();

        for (var spec : specs) {
            if (names.merge(spec.name(), 1, Integer::sum) == 2) {
                problems.add("duplicate service name '" + spec.name() + "'");
            }
            if (spec.image() == null || spec.image().isBlank()) {
                problems.add("service " + spec.name() + ": image is required");
            }
            for (var port : spec.ports()) {
                if (!validPort(port.hostPort()) || !validPort(port.containerPort())) {
                    problems.add("service %s: port out of range %s".formatted(spec.name(), port));
                    continue;
                }
                for (var other : claimed) {
                    if (other.getKey().clashesWith(port)) {
                        problems.add("host binding %s claimed by both %s and %s"
                                .formatted(port.hostKey(), other.getValue(), spec.name()));
                        break;
                    }
                }
                claimed.add(Map.entry(port, spec.name()));
            }
            validateReadiness(spec, problems);
        }
        return problems;
    }

    private static void validateReadiness(ServiceSpec spec, List<String> problems) {
        var readiness = spec.readiness();
        if (readiness.maxAttempts() < 1) {
            problems.add("service " + spec.name() + ": readiness max-attempts must be at least 1");
        }
        if (readiness.interval() == null || readiness.interval().isNegative()) {
            problems.add("service " + spec.name() + ": readiness interval must not be negative");
        }
        switch (readiness.type()) {
            case TCP -> {
                if (spec.bindingFor(readiness.port()).isEmpty()) {
                    problems.add("service %s: tcp readiness port %d is not published"
                            .formatted(spec.name(), readiness.port()));
                }
            }
            case EXEC -> {
                if (readiness.command().isEmpty()) {
                    problems.add("service " + spec.name() + ": exec readiness needs a command");
                }
            }
            case NONE -> { }
        }
    }

    private static boolean validPort(int port) {
        return port >= 1 && port <= 65535;
    }
}
