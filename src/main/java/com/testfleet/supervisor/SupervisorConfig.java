package com.testfleet.supervisor;

import com.github.dockerjava.api.DockerClient;
import com.github.dockerjava.core.DefaultDockerClientConfig;
import com.github.dockerjava.core.DockerClientImpl;
import com.github.dockerjava.zerodep.ZerodepDockerHttpClient;
import com.testfleet.core.config.TestfleetProperties;
import com.testfleet.core.events.EventBus;
import com.testfleet.core.metrics.PipelineMetrics;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class SupervisorConfig {

    private static final String DEFAULT_UNIX_SOCKET = "unix:///var/run/docker.sock";

    // Lazy so that commands which never touch Docker (identity, services) work without a daemon
    @Bean
    @Lazy
    public DockerClient dockerClient(TestfleetProperties properties) {
        String configured = properties.getDocker().getHost();
        String dockerHost = configured != null && !configured.isBlank()
                ? configured
                : System.getenv().getOrDefault("DOCKER_HOST", DEFAULT_UNIX_SOCKET);
        var config = DefaultDockerClientConfig.createDefaultConfigBuilder()
                .withDockerHost(dockerHost)
                .build();
        // ZerodepDockerHttpClient has built-in Unix socket support (no junixsocket needed)
        var httpClient = new ZerodepDockerHttpClient.Builder()
                .dockerHost(config.getDockerHost())
                .sslConfig(config.getSSLConfig())
                .build();
        return DockerClientImpl.getInstance(config, httpClient);
    }

    @Bean
    public ServiceProvider dockerServiceProvider(@Lazy DockerClient dockerClient, TestfleetProperties properties) {
        return new DockerServiceProvider(dockerClient,
                properties.getDocker().getContainerPrefix(),
                properties.getDocker().isPullMissingImages());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService supervisorExecutor(TestfleetProperties properties) {
        var counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(1, properties.getDocker().getMaxParallel()), r -> {
            Thread t = new Thread(r, "supervisor-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @Bean
    public ServiceSupervisor serviceSupervisor(ServiceProvider provider, ExecutorService supervisorExecutor,
                                               TestfleetProperties properties, EventBus eventBus,
                                               PipelineMetrics metrics) {
        return new ServiceSupervisor(provider, ReadinessProbes.defaults(provider), supervisorExecutor,
                properties.getDocker().getStopGraceSeconds(), eventBus, metrics);
    }
}
