package com.testfleet.report;

import com.testfleet.core.config.TestfleetProperties;
import com.testfleet.core.model.BuildNumberSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.URI;
import java.net.http.HttpClient;
import java.nio.file.Path;

@Configuration
public class ReportingConfig {

    @Bean
    @ConditionalOnProperty(prefix = "testfleet.reporting", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ResultFinalizer resultFinalizer(TestfleetProperties properties) {
        var reporting = properties.getReporting();
        var httpClient = HttpClient.newBuilder()
                .connectTimeout(reporting.getConnectTimeout())
                .build();
        return new ResultFinalizer(httpClient, URI.create(reporting.getEndpoint()), reporting.getTokenEnv(),
                System::getenv, reporting.getRequestTimeout(), reporting.getRetryBackoff(),
                BuildNumberSource.parse(properties.getIdentity().getBuildNumberSource()));
    }

    @Bean
    public RunReportWriter runReportWriter(TestfleetProperties properties) {
        return new RunReportWriter(Path.of(properties.getPipeline().getLogDir()).toAbsolutePath().normalize());
    }
}
