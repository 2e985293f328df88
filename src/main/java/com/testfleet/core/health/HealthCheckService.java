package com.testfleet.core.health;

import com.github.dockerjava.api.DockerClient;
import com.testfleet.core.config.TestfleetProperties;
import com.testfleet.core.identity.BuildIdentityResolver;
import com.testfleet.core.identity.IdentityException;
import com.testfleet.core.registry.PhasePlan;
import com.testfleet.core.registry.ServiceRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Preflight checks for a pipeline run: everything a run needs before the first
 * container starts.
 */
@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    private final ObjectProvider<DockerClient> dockerClient;
    private final BuildIdentityResolver identityResolver;
    private final ServiceRegistry registry;
    private final PhasePlan plan;
    private final TestfleetProperties properties;
    private final Function<String, String> envLookup;

    public HealthCheckService(ObjectProvider<DockerClient> dockerClient, BuildIdentityResolver identityResolver,
                              ServiceRegistry registry, PhasePlan plan, TestfleetProperties properties) {
        this(dockerClient, identityResolver, registry, plan, properties, System::getenv);
    }

    HealthCheckService(ObjectProvider<DockerClient> dockerClient, BuildIdentityResolver identityResolver,
                       ServiceRegistry registry, PhasePlan plan, TestfleetProperties properties,
                       Function<String, String> envLookup) {
        this.dockerClient = dockerClient;
        this.identityResolver = identityResolver;
        this.registry = registry;
        this.plan = plan;
        this.properties = properties;
        this.envLookup = envLookup;
    }

    public List<HealthStatus> checkAll() {
        var results = new ArrayList<HealthStatus>();
        results.add(checkConfiguration());
        results.add(checkDocker());
        results.add(checkGit());
        results.add(checkIdentity());
        results.add(checkReporting());
        return results;
    }

    private HealthStatus checkConfiguration() {
        return HealthStatus.up("configuration",
                registry.size() + " services, " + plan.phases().size() + " phases " + plan.names());
    }

    private HealthStatus checkDocker() {
        try {
            var client = dockerClient.getIfAvailable();
            if (client == null) {
                return HealthStatus.down("docker", "No Docker client configured");
            }
            client.pingCmd().exec();
            return HealthStatus.up("docker", "Docker daemon reachable");
        } catch (Exception e) {
            log.warn("Docker health check failed: {}", e.getMessage());
            return HealthStatus.down("docker", "Docker error: " + e.getMessage());
        }
    }

    private HealthStatus checkGit() {
        try {
            return HealthStatus.up("git", identityResolver.gitVersion());
        } catch (IdentityException e) {
            return HealthStatus.down("git", e.getMessage());
        }
    }

    private HealthStatus checkIdentity() {
        try {
            var identity = identityResolver.resolve();
            return new HealthStatus("identity", HealthStatus.Status.UP, "Build " + identity,
                    Map.of("commitCount", String.valueOf(identity.commitCount()),
                            "revision", identity.shortRevision()));
        } catch (IdentityException e) {
            return HealthStatus.down("identity", e.getMessage());
        }
    }

    private HealthStatus checkReporting() {
        var reporting = properties.getReporting();
        if (!reporting.isEnabled()) {
            return HealthStatus.up("reporting", "Reporting disabled");
        }
        String token = envLookup.apply(reporting.getTokenEnv());
        if (token == null || token.isBlank()) {
            return HealthStatus.degraded("reporting",
                    "Token variable " + reporting.getTokenEnv() + " not set; results will not be finalized");
        }
        return HealthStatus.up("reporting", "Token present, endpoint " + reporting.getEndpoint());
    }
}
