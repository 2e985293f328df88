package com.testfleet.core.engine;

import com.testfleet.core.model.BuildIdentity;
import com.testfleet.core.model.PortBinding;
import com.testfleet.core.model.ServiceInstance;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the environment handed to phase commands.
 *
 * <p>Nothing is inherited wholesale. The map holds, in order of precedence (later wins):
 * <ol>
 *   <li>allow-listed variables copied from the process environment</li>
 *   <li>variables configured for the pipeline</li>
 *   <li>{@code TESTFLEET_BUILD_NUMBER}, {@code TESTFLEET_COMMIT_COUNT}, {@code TESTFLEET_REVISION}</li>
 *   <li>{@code TESTFLEET_<SERVICE>_HOST} and {@code TESTFLEET_<SERVICE>_PORT} for every ready service,
 *       plus {@code TESTFLEET_<SERVICE>_PORT_<containerPort>} for each published port</li>
 * </ol>
 */
public class PhaseEnvironment {

    private final Map<String, String> processEnv;
    private final List<String> inheritEnv;
    private final Map<String, String> configured;

    public PhaseEnvironment(Map<String, String> processEnv, List<String> inheritEnv, Map<String, String> configured) {
        this.processEnv = processEnv;
        this.inheritEnv = List.copyOf(inheritEnv);
        this.configured = Map.copyOf(configured);
    }

    public Map<String, String> build(BuildIdentity identity, String buildNumber,
                                     Map<String, ServiceInstance> services) {
        var env = new LinkedHashMap<String, String>();
        for (String name : inheritEnv) {
            String value = processEnv.get(name);
            if (value != null) {
                env.put(name, value);
            }
        }
        env.putAll(configured);

        env.put("TESTFLEET_BUILD_NUMBER", buildNumber);
        env.put("TESTFLEET_COMMIT_COUNT", String.valueOf(identity.commitCount()));
        env.put("TESTFLEET_REVISION", identity.shortRevision());

        for (var instance : services.values()) {
            String prefix = "TESTFLEET_" + envName(instance.name());
            List<PortBinding> ports = instance.spec().ports();
            if (ports.isEmpty()) {
                continue;
            }
            PortBinding first = ports.get(0);
            env.put(prefix + "_HOST", first.connectHost());
            env.put(prefix + "_PORT", String.valueOf(first.hostPort()));
            for (PortBinding port : ports) {
                env.put(prefix + "_PORT_" + port.containerPort(), String.valueOf(port.hostPort()));
            }
        }
        return Collections.unmodifiableMap(env);
    }

    static String envName(String serviceName) {
        return serviceName.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9]", "_");
    }
}
