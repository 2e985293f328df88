package com.testfleet.core.engine;

import com.testfleet.core.config.TestfleetProperties;
import com.testfleet.core.events.EventBus;
import com.testfleet.core.identity.BuildIdentityResolver;
import com.testfleet.core.metrics.PipelineMetrics;
import com.testfleet.core.model.BuildNumberSource;
import com.testfleet.core.registry.PhasePlan;
import com.testfleet.core.registry.ServiceRegistry;
import com.testfleet.phase.PhaseRunner;
import com.testfleet.report.ResultFinalizer;
import com.testfleet.report.RunReportWriter;
import com.testfleet.supervisor.ServiceSupervisor;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.config.ConfigurableBeanFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Scope;

import java.nio.file.Path;

/**
 * Wires the pipeline from {@link TestfleetProperties}. The registry and the phase
 * plan validate on construction, so a bad configuration stops the application
 * before any container is touched.
 */
@Configuration
public class PipelineConfig {

    @Bean
    public ServiceRegistry serviceRegistry(TestfleetProperties properties) {
        return ServiceRegistry.fromProperties(properties.getServices());
    }

    @Bean
    public PhasePlan phasePlan(TestfleetProperties properties) {
        return PhasePlan.fromProperties(properties.getPhases());
    }

    @Bean
    public BuildIdentityResolver buildIdentityResolver(TestfleetProperties properties) {
        return new BuildIdentityResolver(Path.of(properties.getPipeline().getWorkingDir()).toAbsolutePath().normalize());
    }

    @Bean
    public PhaseEnvironment phaseEnvironment(TestfleetProperties properties) {
        var pipeline = properties.getPipeline();
        return new PhaseEnvironment(System.getenv(), pipeline.getInheritEnv(), pipeline.getEnv());
    }

    /** One orchestrator per run; each instance executes once. */
    @Bean
    @Scope(ConfigurableBeanFactory.SCOPE_PROTOTYPE)
    public PipelineOrchestrator pipelineOrchestrator(BuildIdentityResolver identityResolver, ServiceRegistry registry,
                                                     PhasePlan plan, ServiceSupervisor supervisor,
                                                     PhaseRunner phaseRunner, PhaseEnvironment environment,
                                                     ObjectProvider<ResultFinalizer> finalizer,
                                                     RunReportWriter reportWriter, TestfleetProperties properties,
                                                     EventBus eventBus, PipelineMetrics metrics) {
        return new PipelineOrchestrator(identityResolver, registry, plan, supervisor, phaseRunner, environment,
                finalizer.getIfAvailable(), reportWriter,
                BuildNumberSource.parse(properties.getIdentity().getBuildNumberSource()),
                eventBus, metrics);
    }
}
