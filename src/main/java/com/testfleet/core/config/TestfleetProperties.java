package com.testfleet.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything under the {@code testfleet} prefix of application.yml: the backend
 * registry, the phase list, and the knobs of each pipeline component.
 */
@Component
@ConfigurationProperties(prefix = "testfleet")
public class TestfleetProperties {

    private Docker docker = new Docker();
    private Pipeline pipeline = new Pipeline();
    private Identity identity = new Identity();
    private Reporting reporting = new Reporting();
    private List<Service> services = new ArrayList<>();
    private List<Phase> phases = new ArrayList<>();

    public Docker getDocker() { return docker; }
    public void setDocker(Docker docker) { this.docker = docker; }
    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }
    public Identity getIdentity() { return identity; }
    public void setIdentity(Identity identity) { this.identity = identity; }
    public Reporting getReporting() { return reporting; }
    public void setReporting(Reporting reporting) { this.reporting = reporting; }
    public List<Service> getServices() { return services; }
    public void setServices(List<Service> services) { this.services = services; }
    public List<Phase> getPhases() { return phases; }
    public void setPhases(List<Phase> phases) { this.phases = phases; }

    public static class Docker {
        private String host = "";
        private boolean pullMissingImages = true;
        private int stopGraceSeconds = 10;
        private int maxParallel = 8;
        private String containerPrefix = "testfleet";

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }
        public boolean isPullMissingImages() { return pullMissingImages; }
        public void setPullMissingImages(boolean pullMissingImages) { this.pullMissingImages = pullMissingImages; }
        public int getStopGraceSeconds() { return stopGraceSeconds; }
        public void setStopGraceSeconds(int stopGraceSeconds) { this.stopGraceSeconds = stopGraceSeconds; }
        public int getMaxParallel() { return maxParallel; }
        public void setMaxParallel(int maxParallel) { this.maxParallel = maxParallel; }
        public String getContainerPrefix() { return containerPrefix; }
        public void setContainerPrefix(String containerPrefix) { this.containerPrefix = containerPrefix; }
    }

    public static class Pipeline {
        private String workingDir = ".";
        private String logDir = "build/testfleet-logs";
        private String shell = "/bin/sh";
        private int jobs = 0;
        private List<String> inheritEnv = new ArrayList<>(List.of("PATH", "HOME", "LANG"));
        private Map<String, String> env = new LinkedHashMap<>();

        public String getWorkingDir() { return workingDir; }
        public void setWorkingDir(String workingDir) { this.workingDir = workingDir; }
        public String getLogDir() { return logDir; }
        public void setLogDir(String logDir) { this.logDir = logDir; }
        public String getShell() { return shell; }
        public void setShell(String shell) { this.shell = shell; }
        /** Parallelism handed to commands as {@code ${jobs}}; 0 means one per CPU. */
        public int getJobs() { return jobs; }
        public void setJobs(int jobs) { this.jobs = jobs; }
        public List<String> getInheritEnv() { return inheritEnv; }
        public void setInheritEnv(List<String> inheritEnv) { this.inheritEnv = inheritEnv; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }

        public int effectiveJobs() {
            return jobs > 0 ? jobs : Runtime.getRuntime().availableProcessors();
        }
    }

    public static class Identity {
        private String buildNumberSource = "revision";

        public String getBuildNumberSource() { return buildNumberSource; }
        public void setBuildNumberSource(String buildNumberSource) { this.buildNumberSource = buildNumberSource; }
    }

    public static class Reporting {
        private boolean enabled = true;
        private String endpoint = "https://coveralls.io/webhook";
        private String tokenEnv = "COVERALLS_REPO_TOKEN";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration requestTimeout = Duration.ofSeconds(30);
        private Duration retryBackoff = Duration.ofSeconds(5);

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }
        public String getTokenEnv() { return tokenEnv; }
        public void setTokenEnv(String tokenEnv) { this.tokenEnv = tokenEnv; }
        public Duration getConnectTimeout() { return connectTimeout; }
        public void setConnectTimeout(Duration connectTimeout) { this.connectTimeout = connectTimeout; }
        public Duration getRequestTimeout() { return requestTimeout; }
        public void setRequestTimeout(Duration requestTimeout) { this.requestTimeout = requestTimeout; }
        public Duration getRetryBackoff() { return retryBackoff; }
        public void setRetryBackoff(Duration retryBackoff) { this.retryBackoff = retryBackoff; }
    }

    /**
     * One backend as declared in configuration. Ports use the compose short
     * syntax: {@code [bindAddress:]hostPort:containerPort}.
     */
    public static class Service {
        private String name;
        private String image;
        private List<String> command = new ArrayList<>();
        private List<String> ports = new ArrayList<>();
        private Map<String, String> env = new LinkedHashMap<>();
        private String restart = "never";
        private Readiness readiness = new Readiness();

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public String getImage() { return image; }
        public void setImage(String image) { this.image = image; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public List<String> getPorts() { return ports; }
        public void setPorts(List<String> ports) { this.ports = ports; }
        public Map<String, String> getEnv() { return env; }
        public void setEnv(Map<String, String> env) { this.env = env; }
        public String getRestart() { return restart; }
        public void setRestart(String restart) { this.restart = restart; }
        public Readiness getReadiness() { return readiness; }
        public void setReadiness(Readiness readiness) { this.readiness = readiness; }
    }

    public static class Readiness {
        private String type = "tcp";
        private int port = 0;
        private List<String> command = new ArrayList<>();
        private Duration interval = Duration.ofSeconds(2);
        private int maxAttempts = 30;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        /** Container port to probe; 0 means the first published port. */
        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }
        public List<String> getCommand() { return command; }
        public void setCommand(List<String> command) { this.command = command; }
        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }
        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
    }

    public static class Phase {
        private String name;
        private List<String> commands = new ArrayList<>();
        private String filter;
        private boolean producesCoverage = false;
        private String coverageArtifact = ".coverage";
        private boolean blocking = false;
        private Duration timeout = Duration.ofHours(1);

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }
        public List<String> getCommands() { return commands; }
        public void setCommands(List<String> commands) { this.commands = commands; }
        public String getFilter() { return filter; }
        public void setFilter(String filter) { this.filter = filter; }
        public boolean isProducesCoverage() { return producesCoverage; }
        public void setProducesCoverage(boolean producesCoverage) { this.producesCoverage = producesCoverage; }
        public String getCoverageArtifact() { return coverageArtifact; }
        public void setCoverageArtifact(String coverageArtifact) { this.coverageArtifact = coverageArtifact; }
        public boolean isBlocking() { return blocking; }
        public void setBlocking(boolean blocking) { this.blocking = blocking; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }
}
