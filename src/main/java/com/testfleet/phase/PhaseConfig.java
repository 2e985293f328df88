package com.testfleet.phase;

import com.testfleet.core.config.TestfleetProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

@Configuration
public class PhaseConfig {

    @Bean
    public CommandExecutor commandExecutor(TestfleetProperties properties) {
        return new ShellCommandExecutor(properties.getPipeline().getShell());
    }

    @Bean
    public PhaseRunner phaseRunner(CommandExecutor commandExecutor, TestfleetProperties properties) {
        var pipeline = properties.getPipeline();
        return new PhaseRunner(commandExecutor,
                Path.of(pipeline.getWorkingDir()).toAbsolutePath().normalize(),
                Path.of(pipeline.getLogDir()).toAbsolutePath().normalize(),
                pipeline.effectiveJobs());
    }
}
